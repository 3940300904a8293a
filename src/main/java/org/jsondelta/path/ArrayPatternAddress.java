package org.jsondelta.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Structural shape of an address with every array step replaced by {@code []}, so that
 * {@code orders[id=7].lines[0].sku} and {@code orders[1].lines[3].sku} share
 * {@code orders[].lines[].sku}.
 */
public final class ArrayPatternAddress extends AbstractAddress {
    private static final Set<PathSegment.Type> ALLOWED =
        AddressSyntax.types(PathSegment.Type.FIELD, PathSegment.Type.WILDCARD);
    private static final ArrayPatternAddress ROOT = new ArrayPatternAddress(List.of());

    private ArrayPatternAddress(List<? extends PathSegment> segments) {
        super(segments);
    }

    public static ArrayPatternAddress root() {
        return ROOT;
    }

    public static ArrayPatternAddress parse(String text) {
        return of(AddressSyntax.parse(text, ALLOWED, "array pattern"));
    }

    public static ArrayPatternAddress of(List<? extends PathSegment> segments) {
        Objects.requireNonNull(segments, "segments");
        AddressSyntax.requireTypes(segments, ALLOWED, "array pattern");
        return segments.isEmpty() ? ROOT : new ArrayPatternAddress(segments);
    }

    public static ArrayPatternAddress generalize(Address address) {
        Objects.requireNonNull(address, "address");
        if (address instanceof ArrayPatternAddress pattern) {
            return pattern;
        }
        List<PathSegment> generalized = new ArrayList<>(address.depth());
        for (PathSegment segment : address.segments()) {
            generalized.add(segment.isBracket() ? PathSegment.wildcard() : segment);
        }
        return of(generalized);
    }

    public boolean matches(Address address) {
        return equals(generalize(address));
    }

    /**
     * Number of array levels this pattern passes through.
     */
    public int arrayDepth() {
        int count = 0;
        for (PathSegment segment : segments()) {
            if (segment.type() == PathSegment.Type.WILDCARD) {
                count++;
            }
        }
        return count;
    }

    public Optional<String> lastField() {
        List<PathSegment> segments = segments();
        for (int i = segments.size() - 1; i >= 0; i--) {
            if (segments.get(i) instanceof PathSegment.Field field) {
                return Optional.of(field.name());
            }
        }
        return Optional.empty();
    }

    public Optional<ArrayPatternAddress> parent() {
        if (isRoot()) {
            return Optional.empty();
        }
        return Optional.of(new ArrayPatternAddress(segments().subList(0, depth() - 1)));
    }

    /**
     * Pattern of the nearest array this pattern descends through: everything before the last
     * {@code []}. {@code items[].tags[].x} yields {@code items[].tags}.
     */
    public Optional<ArrayPatternAddress> enclosingArray() {
        List<PathSegment> segments = segments();
        for (int i = segments.size() - 1; i >= 0; i--) {
            if (segments.get(i).type() == PathSegment.Type.WILDCARD) {
                return Optional.of(of(segments.subList(0, i)));
            }
        }
        return Optional.empty();
    }
}
