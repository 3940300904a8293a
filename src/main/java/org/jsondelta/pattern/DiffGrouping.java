package org.jsondelta.pattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jsondelta.engine.ComparisonResult;
import org.jsondelta.engine.DiffKind;
import org.jsondelta.engine.DiffRecord;
import org.jsondelta.path.ArrayPatternAddress;
import org.jsondelta.path.IdentityKey;
import org.jsondelta.path.IdentityKeyIndex;

/**
 * Groups differences that sit at structurally equivalent places, e.g. every
 * {@code orders[].total} change regardless of which order it belongs to.
 */
public final class DiffGrouping {
    private DiffGrouping() {}

    public static List<DiffGroup> byArrayPattern(ComparisonResult result) {
        return byArrayPattern(result.diffs(), result.keyIndex());
    }

    public static List<DiffGroup> byArrayPattern(List<DiffRecord> diffs, IdentityKeyIndex keys) {
        Objects.requireNonNull(diffs, "diffs");
        Objects.requireNonNull(keys, "keys");
        Map<ArrayPatternAddress, List<DiffRecord>> grouped = new LinkedHashMap<>();
        for (DiffRecord diff : diffs) {
            grouped.computeIfAbsent(diff.arrayPattern(), ignored -> new ArrayList<>()).add(diff);
        }
        List<DiffGroup> groups = new ArrayList<>(grouped.size());
        for (Map.Entry<ArrayPatternAddress, List<DiffRecord>> entry : grouped.entrySet()) {
            Optional<IdentityKey> key = entry.getKey().enclosingArray().flatMap(keys::keyForPattern);
            groups.add(new DiffGroup(entry.getKey(), key, entry.getValue()));
        }
        return groups;
    }

    /**
     * @param identityKey key of the nearest enclosing array pattern, when all its arrays agree on one
     */
    public record DiffGroup(ArrayPatternAddress pattern, Optional<IdentityKey> identityKey, List<DiffRecord> diffs) {
        public DiffGroup {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(identityKey, "identityKey");
            diffs = List.copyOf(diffs);
        }

        public int size() {
            return diffs.size();
        }

        public int count(DiffKind kind) {
            int total = 0;
            for (DiffRecord diff : diffs) {
                if (diff.kind() == kind) {
                    total++;
                }
            }
            return total;
        }
    }
}
