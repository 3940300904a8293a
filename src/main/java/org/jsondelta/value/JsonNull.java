package org.jsondelta.value;

public enum JsonNull implements JsonValue {
    INSTANCE;

    @Override
    public Kind kind() {
        return Kind.NULL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
