package org.jsondelta.engine;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jsondelta.path.IdentityAddress;
import org.jsondelta.path.IdentityKeyIndex;
import org.jsondelta.path.IdentityKeyInfo;
import org.jsondelta.path.IdentityPathResolver;
import org.jsondelta.path.SidePositions;
import org.jsondelta.value.JsonValue;

/**
 * Outcome of one comparison: the ordered differences and one identity-key record per array location
 * visited. Keeps both documents so identity addresses can be resolved afterwards.
 */
public final class ComparisonResult {
    private final JsonValue left;
    private final JsonValue right;
    private final List<DiffRecord> diffs;
    private final List<IdentityKeyInfo> identityKeys;
    private final IdentityKeyIndex keyIndex;

    ComparisonResult(JsonValue left, JsonValue right, List<DiffRecord> diffs, List<IdentityKeyInfo> identityKeys) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.diffs = List.copyOf(diffs);
        this.identityKeys = List.copyOf(identityKeys);
        this.keyIndex = IdentityKeyIndex.of(this.identityKeys);
    }

    public JsonValue left() {
        return left;
    }

    public JsonValue right() {
        return right;
    }

    public List<DiffRecord> diffs() {
        return diffs;
    }

    public List<IdentityKeyInfo> identityKeys() {
        return identityKeys;
    }

    public IdentityKeyIndex keyIndex() {
        return keyIndex;
    }

    /**
     * Identity-key records of arrays that were matched by key rather than by index.
     */
    public List<IdentityKeyInfo> keyedArrays() {
        List<IdentityKeyInfo> keyed = new ArrayList<>();
        for (IdentityKeyInfo info : identityKeys) {
            if (info.isKeyed()) {
                keyed.add(info);
            }
        }
        return keyed;
    }

    public boolean hasDifferences() {
        return !diffs.isEmpty();
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

    public Map<DiffKind, Integer> countsByKind() {
        Map<DiffKind, Integer> counts = new EnumMap<>(DiffKind.class);
        for (DiffKind kind : DiffKind.values()) {
            counts.put(kind, count(kind));
        }
        return counts;
    }

    public SidePositions resolve(IdentityAddress address) {
        return IdentityPathResolver.bothSides(address, left, right, keyIndex);
    }
}
