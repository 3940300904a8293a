package org.jsondelta.pattern;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jsondelta.engine.DiffRecord;
import org.jsondelta.path.Address;
import org.jsondelta.path.IdentityAddress;

/**
 * Differences the user chose to hide: glob patterns plus exact identity addresses. Mutable and not
 * thread-safe.
 */
public final class IgnoreList {
    private final Map<String, AddressPattern> patterns = new LinkedHashMap<>();
    private final Set<IdentityAddress> addresses = new LinkedHashSet<>();

    public static IgnoreList of(Collection<String> patterns) {
        IgnoreList list = new IgnoreList();
        for (String pattern : patterns) {
            list.addPattern(pattern);
        }
        return list;
    }

    public AddressPattern addPattern(String pattern) {
        AddressPattern compiled = AddressPattern.compile(pattern);
        patterns.putIfAbsent(compiled.text(), compiled);
        return compiled;
    }

    public boolean removePattern(String pattern) {
        return patterns.remove(pattern) != null;
    }

    public void ignore(IdentityAddress address) {
        addresses.add(Objects.requireNonNull(address, "address"));
    }

    /**
     * Hides {@code address} and everything nested below it by storing the pattern {@code address*}.
     */
    public AddressPattern ignoreSubtree(IdentityAddress address) {
        Objects.requireNonNull(address, "address");
        if (address.isRoot()) {
            throw new IllegalArgumentException("cannot ignore the whole document");
        }
        return addPattern(address.text() + "*");
    }

    /**
     * Undoes {@link #ignore} and {@link #ignoreSubtree} for {@code address}.
     */
    public boolean restore(IdentityAddress address) {
        Objects.requireNonNull(address, "address");
        boolean removed = addresses.remove(address);
        if (!address.isRoot()) {
            removed |= removePattern(address.text() + "*");
        }
        return removed;
    }

    public boolean isIgnored(Address address) {
        Objects.requireNonNull(address, "address");
        if (address instanceof IdentityAddress identity && addresses.contains(identity)) {
            return true;
        }
        for (AddressPattern pattern : patterns.values()) {
            if (pattern.matches(address)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A difference is hidden when its identity address or either position address is.
     */
    public boolean isIgnored(DiffRecord diff) {
        Objects.requireNonNull(diff, "diff");
        return isIgnored(diff.identityAddress())
            || diff.leftAddress().map(this::isIgnored).orElse(false)
            || diff.rightAddress().map(this::isIgnored).orElse(false);
    }

    public Partition partition(List<DiffRecord> diffs) {
        List<DiffRecord> kept = new ArrayList<>();
        List<DiffRecord> ignored = new ArrayList<>();
        for (DiffRecord diff : diffs) {
            (isIgnored(diff) ? ignored : kept).add(diff);
        }
        return new Partition(kept, ignored);
    }

    public List<String> patterns() {
        return List.copyOf(patterns.keySet());
    }

    public Set<IdentityAddress> ignoredAddresses() {
        return Set.copyOf(addresses);
    }

    public boolean isEmpty() {
        return patterns.isEmpty() && addresses.isEmpty();
    }

    public void clear() {
        patterns.clear();
        addresses.clear();
    }

    public record Partition(List<DiffRecord> kept, List<DiffRecord> ignored) {
        public Partition {
            kept = List.copyOf(kept);
            ignored = List.copyOf(ignored);
        }
    }
}
