package org.jsondelta.engine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.jsondelta.path.IdentityKey;
import org.jsondelta.value.JsonArray;
import org.jsondelta.value.JsonObject;
import org.jsondelta.value.JsonValue;

/**
 * Chooses the field, or smallest field combination, whose values identify the elements of an array
 * on both sides of a comparison.
 *
 * <p>Only arrays made entirely of objects are considered. Single fields are tried before pairs, and
 * pairs before triples; within one size preferred keys come first and the remaining fields follow in
 * name order, so the choice does not depend on which document is the left one. Detection never fails:
 * no qualifying key means the array is compared by index.
 */
public final class IdentityKeyDetector {
    private final DetectorSettings settings;

    public IdentityKeyDetector() {
        this(DetectorSettings.defaults());
    }

    public IdentityKeyDetector(DetectorSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public DetectorSettings settings() {
        return settings;
    }

    /**
     * Either argument may be {@code null} for an array missing on that side.
     */
    public Optional<IdentityKey> detect(JsonArray left, JsonArray right) {
        JsonArray safeLeft = left == null ? JsonArray.empty() : left;
        JsonArray safeRight = right == null ? JsonArray.empty() : right;
        if (safeLeft.size() < settings.minArraySize() && safeRight.size() < settings.minArraySize()) {
            return Optional.empty();
        }
        if (!allObjects(safeLeft) || !allObjects(safeRight)) {
            return Optional.empty();
        }

        List<String> candidates = candidateFields(safeLeft, safeRight);
        for (String field : candidates) {
            IdentityKey key = new IdentityKey(List.of(field));
            if (qualifies(key, safeLeft, safeRight)) {
                return Optional.of(key);
            }
        }
        List<String> pool = candidates.subList(0, Math.min(candidates.size(), settings.compositeCandidateLimit()));
        for (int size = 2; size <= settings.maxCompositeSize(); size++) {
            Optional<IdentityKey> found = firstQualifyingCombination(pool, size, safeLeft, safeRight);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Fields holding a scalar on at least one element of either side: preferred keys in their
     * configured order, then the rest sorted by name.
     */
    List<String> candidateFields(JsonArray left, JsonArray right) {
        Set<String> seen = new TreeSet<>();
        collectScalarFields(left, seen);
        collectScalarFields(right, seen);
        List<String> ordered = new ArrayList<>(seen.size());
        for (String preferred : settings.preferredKeys()) {
            if (seen.remove(preferred)) {
                ordered.add(preferred);
            }
        }
        ordered.addAll(seen);
        return ordered;
    }

    boolean qualifies(IdentityKey key, JsonArray left, JsonArray right) {
        Optional<Set<List<String>>> leftValues = uniqueKeyTexts(key, left);
        if (leftValues.isEmpty()) {
            return false;
        }
        Optional<Set<List<String>>> rightValues = uniqueKeyTexts(key, right);
        if (rightValues.isEmpty()) {
            return false;
        }
        Set<List<String>> l = leftValues.get();
        Set<List<String>> r = rightValues.get();
        if (l.isEmpty() || r.isEmpty()) {
            return true;
        }
        Set<List<String>> shared = new HashSet<>(l);
        shared.retainAll(r);
        double overlap = (double) shared.size() / Math.min(l.size(), r.size());
        return overlap >= settings.minOverlapRatio();
    }

    private Optional<IdentityKey> firstQualifyingCombination(
        List<String> pool, int size, JsonArray left, JsonArray right) {
        if (pool.size() < size) {
            return Optional.empty();
        }
        int[] picks = new int[size];
        for (int i = 0; i < size; i++) {
            picks[i] = i;
        }
        while (true) {
            List<String> fields = new ArrayList<>(size);
            for (int pick : picks) {
                fields.add(pool.get(pick));
            }
            IdentityKey key = new IdentityKey(fields);
            if (qualifies(key, left, right)) {
                return Optional.of(key);
            }
            int i = size - 1;
            while (i >= 0 && picks[i] == pool.size() - size + i) {
                i--;
            }
            if (i < 0) {
                return Optional.empty();
            }
            picks[i]++;
            for (int j = i + 1; j < size; j++) {
                picks[j] = picks[j - 1] + 1;
            }
        }
    }

    // compared as key texts: 1 and "1" address the same segment, so they collide
    private static Optional<Set<List<String>>> uniqueKeyTexts(IdentityKey key, JsonArray array) {
        Set<List<String>> texts = new HashSet<>();
        for (JsonValue element : array.elements()) {
            Optional<List<JsonValue>> values = key.valuesOf(element);
            if (values.isEmpty() || !texts.add(values.get().stream().map(IdentityKey::keyText).toList())) {
                return Optional.empty();
            }
        }
        return Optional.of(texts);
    }

    private static void collectScalarFields(JsonArray array, Set<String> into) {
        for (JsonValue element : array.elements()) {
            for (var entry : ((JsonObject) element).fields().entrySet()) {
                // an empty name cannot be written as a key segment
                if (entry.getValue().isScalar() && !entry.getKey().isEmpty()) {
                    into.add(entry.getKey());
                }
            }
        }
    }

    private static boolean allObjects(JsonArray array) {
        for (JsonValue element : array.elements()) {
            if (element.kind() != JsonValue.Kind.OBJECT) {
                return false;
            }
        }
        return true;
    }
}
