package org.jsondelta.path;

public enum Side {
    LEFT("left"),
    RIGHT("right");

    private final String tag;

    Side(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public Side other() {
        return this == LEFT ? RIGHT : LEFT;
    }

    public static Side fromTag(String tag) {
        for (Side side : values()) {
            if (side.tag.equals(tag)) {
                return side;
            }
        }
        throw new IllegalArgumentException("unknown side: " + tag);
    }
}
