package org.jsondelta.engine;

public enum DiffKind {
    ADDED,
    REMOVED,
    CHANGED;

    /**
     * Kind of the same difference seen with the two documents swapped.
     */
    public DiffKind mirror() {
        return switch (this) {
            case ADDED -> REMOVED;
            case REMOVED -> ADDED;
            case CHANGED -> CHANGED;
        };
    }
}
