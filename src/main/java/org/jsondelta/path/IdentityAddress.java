package org.jsondelta.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Side-neutral address: elements of keyed arrays are named by their identity key, everything else
 * by field name or index.
 */
public final class IdentityAddress extends AbstractAddress {
    private static final Set<PathSegment.Type> ALLOWED =
        AddressSyntax.types(PathSegment.Type.FIELD, PathSegment.Type.INDEX, PathSegment.Type.KEY);
    private static final IdentityAddress ROOT = new IdentityAddress(List.of());

    private IdentityAddress(List<? extends PathSegment> segments) {
        super(segments);
    }

    public static IdentityAddress root() {
        return ROOT;
    }

    public static IdentityAddress parse(String text) {
        return of(AddressSyntax.parse(text, ALLOWED, "identity address"));
    }

    public static IdentityAddress of(List<? extends PathSegment> segments) {
        Objects.requireNonNull(segments, "segments");
        AddressSyntax.requireTypes(segments, ALLOWED, "identity address");
        return segments.isEmpty() ? ROOT : new IdentityAddress(segments);
    }

    public IdentityAddress field(String name) {
        return child(PathSegment.field(name));
    }

    public IdentityAddress index(int index) {
        return child(PathSegment.index(index));
    }

    public IdentityAddress child(PathSegment segment) {
        Objects.requireNonNull(segment, "segment");
        if (!ALLOWED.contains(segment.type())) {
            throw new IllegalArgumentException("wildcard segment not allowed in identity address");
        }
        List<PathSegment> next = new ArrayList<>(depth() + 1);
        next.addAll(segments());
        next.add(segment);
        return new IdentityAddress(next);
    }

    public Optional<IdentityAddress> parent() {
        if (isRoot()) {
            return Optional.empty();
        }
        return Optional.of(new IdentityAddress(segments().subList(0, depth() - 1)));
    }

    /**
     * Position-shaped addresses are valid identity addresses as they stand.
     */
    public static IdentityAddress fromPosition(PositionAddress address) {
        return new IdentityAddress(address.segments());
    }

    public boolean hasKeySegments() {
        for (PathSegment segment : segments()) {
            if (segment.type() == PathSegment.Type.KEY) {
                return true;
            }
        }
        return false;
    }

    public ArrayPatternAddress generalize() {
        return ArrayPatternAddress.generalize(this);
    }
}
