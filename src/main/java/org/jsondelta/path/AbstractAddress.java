package org.jsondelta.path;

import java.util.List;

abstract class AbstractAddress implements Address {
    private final List<PathSegment> segments;
    private final String text;

    AbstractAddress(List<? extends PathSegment> segments) {
        this.segments = List.copyOf(segments);
        this.text = AddressSyntax.render(this.segments);
    }

    @Override
    public final List<PathSegment> segments() {
        return segments;
    }

    @Override
    public final String text() {
        return text;
    }

    @Override
    public final boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        return segments.equals(((AbstractAddress) other).segments);
    }

    @Override
    public final int hashCode() {
        return 31 * getClass().hashCode() + segments.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
