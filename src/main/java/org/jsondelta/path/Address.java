package org.jsondelta.path;

import java.util.List;
import java.util.Optional;

/**
 * Immutable sequence of {@link PathSegment}s with a canonical text form. Two addresses of the same
 * kind are equal exactly when their segments are.
 */
public interface Address {
    List<PathSegment> segments();

    String text();

    default boolean isRoot() {
        return segments().isEmpty();
    }

    default int depth() {
        return segments().size();
    }

    default Optional<PathSegment> lastSegment() {
        List<PathSegment> segments = segments();
        return segments.isEmpty() ? Optional.empty() : Optional.of(segments.get(segments.size() - 1));
    }

    /**
     * True when {@code prefix} names this node or one of its ancestors.
     */
    default boolean startsWith(Address prefix) {
        List<PathSegment> own = segments();
        List<PathSegment> other = prefix.segments();
        return other.size() <= own.size() && own.subList(0, other.size()).equals(other);
    }
}
