package org.jsondelta.path;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jsondelta.value.JsonArray;
import org.jsondelta.value.JsonValue;

/**
 * Translates between identity addresses and position addresses of one concrete document, using the
 * identity keys recorded by a comparison.
 *
 * <p>Index segments always mean a literal index. A key segment only resolves when the key recorded
 * for that array has exactly the segment's fields; otherwise the address is absent in the document.
 */
public final class IdentityPathResolver {
    private IdentityPathResolver() {}

    public static Optional<PositionAddress> toPosition(
        IdentityAddress address, JsonValue document, Collection<IdentityKeyInfo> keys) {
        return toPosition(address, document, IdentityKeyIndex.of(keys));
    }

    public static Optional<PositionAddress> toPosition(
        IdentityAddress address, JsonValue document, IdentityKeyIndex keys) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(keys, "keys");

        JsonValue current = document;
        IdentityAddress walked = IdentityAddress.root();
        List<PathSegment> resolved = new ArrayList<>(address.depth());
        for (PathSegment segment : address.segments()) {
            Optional<JsonValue> next;
            switch (segment.type()) {
                case FIELD -> {
                    next = current.field(((PathSegment.Field) segment).name());
                    resolved.add(segment);
                }
                case INDEX -> {
                    next = current.element(((PathSegment.Index) segment).index());
                    resolved.add(segment);
                }
                case KEY -> {
                    if (!(current instanceof JsonArray array)) {
                        return Optional.empty();
                    }
                    int index = indexOfKey(array, walked, (PathSegment.Key) segment, keys);
                    if (index < 0) {
                        return Optional.empty();
                    }
                    next = Optional.of(array.get(index));
                    resolved.add(PathSegment.index(index));
                }
                default -> throw new IllegalStateException("unexpected segment in identity address: " + segment);
            }
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
            walked = walked.child(segment);
        }
        return Optional.of(PositionAddress.of(resolved));
    }

    public static SidePositions bothSides(
        IdentityAddress address, JsonValue left, JsonValue right, Collection<IdentityKeyInfo> keys) {
        return bothSides(address, left, right, IdentityKeyIndex.of(keys));
    }

    public static SidePositions bothSides(
        IdentityAddress address, JsonValue left, JsonValue right, IdentityKeyIndex keys) {
        return new SidePositions(toPosition(address, left, keys), toPosition(address, right, keys));
    }

    /**
     * Inverse of {@link #toPosition}: indices into keyed arrays become key segments, numbered the way
     * the comparison numbers repeated key texts.
     */
    public static Optional<IdentityAddress> toIdentity(
        PositionAddress address, JsonValue document, Collection<IdentityKeyInfo> keys) {
        return toIdentity(address, document, IdentityKeyIndex.of(keys));
    }

    public static Optional<IdentityAddress> toIdentity(
        PositionAddress address, JsonValue document, IdentityKeyIndex keys) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(keys, "keys");

        JsonValue current = document;
        IdentityAddress walked = IdentityAddress.root();
        for (PathSegment segment : address.segments()) {
            if (segment instanceof PathSegment.Field field) {
                Optional<JsonValue> next = current.field(field.name());
                if (next.isEmpty()) {
                    return Optional.empty();
                }
                walked = walked.child(segment);
                current = next.get();
                continue;
            }
            int index = ((PathSegment.Index) segment).index();
            if (!(current instanceof JsonArray array) || index >= array.size()) {
                return Optional.empty();
            }
            Optional<IdentityKey> key = keys.keyFor(walked);
            if (key.isPresent() && key.get().appliesTo(array)) {
                walked = walked.child(key.get().segmentsFor(array).get(index).orElseThrow());
            } else {
                walked = walked.child(segment);
            }
            current = array.get(index);
        }
        return Optional.of(walked);
    }

    /**
     * True when {@code identity} and {@code scoped} name the same node of the scoped side's document.
     */
    public static boolean equivalent(
        IdentityAddress identity,
        ScopedAddress scoped,
        JsonValue left,
        JsonValue right,
        Collection<IdentityKeyInfo> keys) {
        Objects.requireNonNull(scoped, "scoped");
        JsonValue document = scoped.side() == Side.LEFT ? left : right;
        return toPosition(identity, document, IdentityKeyIndex.of(keys))
            .map(scoped.address()::equals)
            .orElse(false);
    }

    /**
     * First element of the array at {@code arrayAddress} (in left order) that exists on both sides.
     * Keyed arrays match by key; positional arrays offer index 0 when both sides are non-empty.
     */
    public static Optional<IdentityAddress> firstCommonElement(
        IdentityAddress arrayAddress, JsonValue left, JsonValue right, Collection<IdentityKeyInfo> keys) {
        IdentityKeyIndex index = IdentityKeyIndex.of(keys);
        Optional<JsonArray> leftArray = arrayAt(arrayAddress, left, index);
        Optional<JsonArray> rightArray = arrayAt(arrayAddress, right, index);
        if (leftArray.isEmpty() || rightArray.isEmpty()) {
            return Optional.empty();
        }
        Optional<IdentityKey> key = index.keyFor(arrayAddress);
        if (key.isPresent() && key.get().appliesTo(leftArray.get()) && key.get().appliesTo(rightArray.get())) {
            Set<PathSegment.Key> rightSegments = new HashSet<>();
            for (Optional<PathSegment.Key> segment : key.get().segmentsFor(rightArray.get())) {
                segment.ifPresent(rightSegments::add);
            }
            for (Optional<PathSegment.Key> segment : key.get().segmentsFor(leftArray.get())) {
                if (segment.isPresent() && rightSegments.contains(segment.get())) {
                    return Optional.of(arrayAddress.child(segment.get()));
                }
            }
            return Optional.empty();
        }
        if (leftArray.get().isEmpty() || rightArray.get().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(arrayAddress.index(0));
    }

    private static Optional<JsonArray> arrayAt(IdentityAddress address, JsonValue document, IdentityKeyIndex keys) {
        return toPosition(address, document, keys)
            .flatMap(position -> position.resolve(document))
            .filter(JsonArray.class::isInstance)
            .map(JsonArray.class::cast);
    }

    private static int indexOfKey(
        JsonArray array, IdentityAddress arrayAddress, PathSegment.Key segment, IdentityKeyIndex keys) {
        Optional<IdentityKey> key = keys.keyFor(arrayAddress);
        if (key.isEmpty() || !key.get().matches(segment)) {
            return -1;
        }
        List<Optional<PathSegment.Key>> segments = key.get().segmentsFor(array);
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).filter(segment::equals).isPresent()) {
                return i;
            }
        }
        return -1;
    }
}
