package org.jsondelta.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jsondelta.obs.CorrelationContext;
import org.jsondelta.obs.JsonLinesLogger;
import org.jsondelta.path.ArrayPatternAddress;
import org.jsondelta.path.IdentityAddress;
import org.jsondelta.path.IdentityKey;
import org.jsondelta.path.IdentityKeyInfo;
import org.jsondelta.path.PathSegment;
import org.jsondelta.path.PositionAddress;
import org.jsondelta.path.ScopedAddress;
import org.jsondelta.path.Side;
import org.jsondelta.value.JsonArray;
import org.jsondelta.value.JsonObject;
import org.jsondelta.value.JsonValue;
import org.jsondelta.value.JsonValues;

/**
 * Walks two documents in lock-step and reports their differences.
 *
 * <p>Object fields are visited in left declaration order, then right-only fields. Elements of keyed
 * arrays are paired by identity key (left order, then right-only elements); other arrays are paired
 * by index. Each call keeps its own detection cache, so one engine may serve concurrent callers.
 */
public final class JsonDiffEngine {
    private final CompareOptions options;
    private final IdentityKeyDetector detector;
    private final JsonLinesLogger logger;

    public JsonDiffEngine() {
        this(CompareOptions.defaults());
    }

    public JsonDiffEngine(CompareOptions options) {
        this(options, JsonLinesLogger.NOOP);
    }

    public JsonDiffEngine(CompareOptions options, JsonLinesLogger logger) {
        this.options = Objects.requireNonNull(options, "options");
        this.detector = new IdentityKeyDetector(options.detector());
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public CompareOptions options() {
        return options;
    }

    public ComparisonResult compare(JsonValue left, JsonValue right) {
        return compare(left, right, CorrelationContext.next("compare"));
    }

    public ComparisonResult compare(JsonValue left, JsonValue right, CorrelationContext correlation) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(correlation, "correlation");
        long startedAt = System.nanoTime();
        logger.info("compare.start", correlation, Map.of(
            "leftNodes", JsonValues.nodeCount(left),
            "rightNodes", JsonValues.nodeCount(right),
            "keyScope", options.keyScope(),
            "oneSidedMode", options.oneSidedMode()));

        Walk walk = new Walk(correlation);
        walk.node(left, right, IdentityAddress.root(), PositionAddress.root(), PositionAddress.root(), null);
        ComparisonResult result = new ComparisonResult(left, right, walk.diffs, new ArrayList<>(walk.infos.values()));

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("diffs", result.diffs().size());
        fields.put("added", result.count(DiffKind.ADDED));
        fields.put("removed", result.count(DiffKind.REMOVED));
        fields.put("changed", result.count(DiffKind.CHANGED));
        fields.put("arrays", result.identityKeys().size());
        fields.put("keyedArrays", result.keyedArrays().size());
        fields.put("durationMs", (System.nanoTime() - startedAt) / 1_000_000L);
        logger.info("compare.complete", correlation, fields);
        return result;
    }

    /**
     * Identity keys for every array of a single document, as if its counterpart were not loaded yet.
     */
    public List<IdentityKeyInfo> detectIdentityKeys(JsonValue document) {
        return detectIdentityKeys(document, Side.LEFT);
    }

    public List<IdentityKeyInfo> detectIdentityKeys(JsonValue document, Side side) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(side, "side");
        List<IdentityKeyInfo> infos = new ArrayList<>();
        annotate(document, side, IdentityAddress.root(), PositionAddress.root(), infos);
        logger.debug("detect.complete", CorrelationContext.next("detectIdentityKeys"), Map.of(
            "side", side.tag(),
            "arrays", infos.size()));
        return infos;
    }

    private void annotate(
        JsonValue node, Side side, IdentityAddress identity, PositionAddress position, List<IdentityKeyInfo> into) {
        switch (node.kind()) {
            case NULL, BOOLEAN, NUMBER, STRING -> {
            }
            case OBJECT -> {
                for (Map.Entry<String, JsonValue> entry : ((JsonObject) node).fields().entrySet()) {
                    annotate(entry.getValue(), side, identity.field(entry.getKey()), position.field(entry.getKey()), into);
                }
            }
            case ARRAY -> {
                JsonArray array = (JsonArray) node;
                Optional<IdentityKey> key = side == Side.LEFT
                    ? detector.detect(array, null)
                    : detector.detect(null, array);
                into.add(new IdentityKeyInfo(
                    ScopedAddress.of(side, position),
                    identity,
                    key.orElse(null),
                    side == Side.LEFT ? array.size() : 0,
                    side == Side.RIGHT ? array.size() : 0,
                    false));
                List<Optional<PathSegment.Key>> segments = key.map(k -> k.segmentsFor(array)).orElse(null);
                for (int i = 0; i < array.size(); i++) {
                    PathSegment segment = segments == null
                        ? PathSegment.index(i)
                        : segments.get(i).orElseThrow();
                    annotate(array.get(i), side, identity.child(segment), position.index(i), into);
                }
            }
        }
    }

    /**
     * State of one {@code compare} call.
     */
    private final class Walk {
        private final CorrelationContext correlation;
        private final List<DiffRecord> diffs = new ArrayList<>();
        private final Map<IdentityAddress, IdentityKeyInfo> infos = new LinkedHashMap<>();
        private final Map<ArrayPatternAddress, IdentityKey> patternKeys = new HashMap<>();

        private Walk(CorrelationContext correlation) {
            this.correlation = correlation;
        }

        /**
         * {@code left}/{@code right} are {@code null} when the node is missing on that side; the
         * matching position address is ignored then.
         */
        void node(
            JsonValue left,
            JsonValue right,
            IdentityAddress identity,
            PositionAddress leftAt,
            PositionAddress rightAt,
            IdentityKey elementKey) {
            if (left == null && right == null) {
                return;
            }
            if (left == null || right == null) {
                oneSided(left, right, identity, leftAt, rightAt, elementKey);
                return;
            }
            if (left.kind() != right.kind()) {
                diffs.add(DiffRecord.changed(identity, leftAt, rightAt, left, right, elementKey));
                return;
            }
            switch (left.kind()) {
                case NULL, BOOLEAN, NUMBER, STRING -> {
                    if (!left.equals(right)) {
                        diffs.add(DiffRecord.changed(identity, leftAt, rightAt, left, right, elementKey));
                    }
                }
                case OBJECT -> object((JsonObject) left, (JsonObject) right, identity, leftAt, rightAt);
                case ARRAY -> array((JsonArray) left, (JsonArray) right, identity, leftAt, rightAt);
            }
        }

        private void oneSided(
            JsonValue left,
            JsonValue right,
            IdentityAddress identity,
            PositionAddress leftAt,
            PositionAddress rightAt,
            IdentityKey elementKey) {
            JsonValue present = left != null ? left : right;
            boolean expand = options.oneSidedMode() == OneSidedMode.EXPAND
                && present.kind().isContainer()
                && !isEmptyContainer(present);
            if (!expand) {
                diffs.add(left != null
                    ? DiffRecord.removed(identity, leftAt, left, elementKey)
                    : DiffRecord.added(identity, rightAt, right, elementKey));
                return;
            }
            if (present.kind() == JsonValue.Kind.OBJECT) {
                object((JsonObject) left, (JsonObject) right, identity, leftAt, rightAt);
            } else {
                array((JsonArray) left, (JsonArray) right, identity, leftAt, rightAt);
            }
        }

        private void object(
            JsonObject left, JsonObject right, IdentityAddress identity, PositionAddress leftAt, PositionAddress rightAt) {
            Set<String> names = new LinkedHashSet<>();
            if (left != null) {
                names.addAll(left.fieldNames());
            }
            if (right != null) {
                names.addAll(right.fieldNames());
            }
            for (String name : names) {
                node(
                    left == null ? null : left.field(name).orElse(null),
                    right == null ? null : right.field(name).orElse(null),
                    identity.field(name),
                    left == null ? null : leftAt.field(name),
                    right == null ? null : rightAt.field(name),
                    null);
            }
        }

        private void array(
            JsonArray left, JsonArray right, IdentityAddress identity, PositionAddress leftAt, PositionAddress rightAt) {
            JsonArray safeLeft = left == null ? JsonArray.empty() : left;
            JsonArray safeRight = right == null ? JsonArray.empty() : right;
            Optional<IdentityKey> key = keyFor(safeLeft, safeRight, identity, left == null ? null : leftAt, rightAt);
            if (key.isPresent()) {
                keyedElements(key.get(), safeLeft, safeRight, identity, leftAt, rightAt);
                return;
            }
            int length = Math.max(safeLeft.size(), safeRight.size());
            for (int i = 0; i < length; i++) {
                node(
                    i < safeLeft.size() ? safeLeft.get(i) : null,
                    i < safeRight.size() ? safeRight.get(i) : null,
                    identity.index(i),
                    i < safeLeft.size() ? leftAt.index(i) : null,
                    i < safeRight.size() ? rightAt.index(i) : null,
                    null);
            }
        }

        private void keyedElements(
            IdentityKey key,
            JsonArray left,
            JsonArray right,
            IdentityAddress identity,
            PositionAddress leftAt,
            PositionAddress rightAt) {
            List<PathSegment.Key> leftSegments = presentSegments(key, left);
            List<PathSegment.Key> rightSegments = presentSegments(key, right);
            Map<PathSegment.Key, Integer> rightIndex = new HashMap<>();
            for (int j = 0; j < rightSegments.size(); j++) {
                rightIndex.put(rightSegments.get(j), j);
            }
            Set<PathSegment.Key> leftKeys = new HashSet<>(leftSegments);
            for (int i = 0; i < leftSegments.size(); i++) {
                PathSegment.Key segment = leftSegments.get(i);
                Integer j = rightIndex.get(segment);
                node(
                    left.get(i),
                    j == null ? null : right.get(j),
                    identity.child(segment),
                    leftAt.index(i),
                    j == null ? null : rightAt.index(j),
                    key);
            }
            for (int j = 0; j < rightSegments.size(); j++) {
                PathSegment.Key segment = rightSegments.get(j);
                if (!leftKeys.contains(segment)) {
                    node(null, right.get(j), identity.child(segment), null, rightAt.index(j), key);
                }
            }
        }

        private Optional<IdentityKey> keyFor(
            JsonArray left, JsonArray right, IdentityAddress identity, PositionAddress leftAt, PositionAddress rightAt) {
            IdentityKeyInfo known = infos.get(identity);
            if (known != null) {
                return known.key();
            }
            ScopedAddress scoped = leftAt != null ? ScopedAddress.left(leftAt) : ScopedAddress.right(rightAt);
            boolean patternScope = options.keyScope() == KeyScope.PATTERN;
            ArrayPatternAddress pattern = identity.generalize();
            IdentityKey shared = patternScope ? patternKeys.get(pattern) : null;

            Optional<IdentityKey> key;
            if (shared != null && shared.appliesTo(left) && shared.appliesTo(right)) {
                key = Optional.of(shared);
            } else {
                key = detector.detect(left, right);
                if (patternScope) {
                    key.ifPresent(found -> patternKeys.putIfAbsent(pattern, found));
                }
            }
            IdentityKeyInfo info = new IdentityKeyInfo(
                scoped, identity, key.orElse(null), left.size(), right.size(), patternScope && key.isPresent());
            infos.put(identity, info);
            logger.debug("identity.detect", correlation, Map.of(
                "array", identity.text(),
                "key", key.map(IdentityKey::displayName).orElse(""),
                "sizeLeft", left.size(),
                "sizeRight", right.size()));
            return key;
        }

        private List<PathSegment.Key> presentSegments(IdentityKey key, JsonArray array) {
            List<PathSegment.Key> segments = new ArrayList<>(array.size());
            for (Optional<PathSegment.Key> segment : key.segmentsFor(array)) {
                segments.add(segment.orElseThrow(() -> new IllegalStateException(
                    "identity key " + key.displayName() + " does not cover every element")));
            }
            return segments;
        }

        private boolean isEmptyContainer(JsonValue value) {
            if (value instanceof JsonObject object) {
                return object.isEmpty();
            }
            return value instanceof JsonArray array && array.isEmpty();
        }
    }
}
