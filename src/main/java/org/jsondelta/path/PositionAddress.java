package org.jsondelta.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jsondelta.value.JsonValue;

/**
 * Location inside one concrete document: field names and zero-based array indices.
 */
public final class PositionAddress extends AbstractAddress {
    private static final Set<PathSegment.Type> ALLOWED =
        AddressSyntax.types(PathSegment.Type.FIELD, PathSegment.Type.INDEX);
    private static final PositionAddress ROOT = new PositionAddress(List.of());

    private PositionAddress(List<? extends PathSegment> segments) {
        super(segments);
    }

    public static PositionAddress root() {
        return ROOT;
    }

    public static PositionAddress parse(String text) {
        return of(AddressSyntax.parse(text, ALLOWED, "position address"));
    }

    public static PositionAddress of(List<? extends PathSegment> segments) {
        Objects.requireNonNull(segments, "segments");
        AddressSyntax.requireTypes(segments, ALLOWED, "position address");
        return segments.isEmpty() ? ROOT : new PositionAddress(segments);
    }

    public PositionAddress field(String name) {
        return append(PathSegment.field(name));
    }

    public PositionAddress index(int index) {
        return append(PathSegment.index(index));
    }

    public Optional<PositionAddress> parent() {
        if (isRoot()) {
            return Optional.empty();
        }
        return Optional.of(new PositionAddress(segments().subList(0, depth() - 1)));
    }

    /**
     * Follows this address inside {@code document}; empty when any step is missing or lands on the
     * wrong kind of container.
     */
    public Optional<JsonValue> resolve(JsonValue document) {
        Objects.requireNonNull(document, "document");
        JsonValue current = document;
        for (PathSegment segment : segments()) {
            Optional<JsonValue> next = segment instanceof PathSegment.Field field
                ? current.field(field.name())
                : current.element(((PathSegment.Index) segment).index());
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    private PositionAddress append(PathSegment segment) {
        List<PathSegment> next = new ArrayList<>(depth() + 1);
        next.addAll(segments());
        next.add(segment);
        return new PositionAddress(next);
    }
}
