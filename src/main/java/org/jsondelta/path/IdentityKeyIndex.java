package org.jsondelta.path;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookup over detection results by array identity address, falling back to the array pattern for
 * keys shared across a pattern.
 */
public final class IdentityKeyIndex {
    private static final IdentityKeyIndex EMPTY = new IdentityKeyIndex(List.of());

    private final List<IdentityKeyInfo> entries;
    private final Map<IdentityAddress, IdentityKeyInfo> byAddress = new LinkedHashMap<>();
    private final Map<ArrayPatternAddress, IdentityKeyInfo> sharedByPattern = new LinkedHashMap<>();

    private IdentityKeyIndex(Collection<IdentityKeyInfo> entries) {
        this.entries = List.copyOf(entries);
        for (IdentityKeyInfo info : this.entries) {
            byAddress.putIfAbsent(info.arrayIdentityAddress(), info);
            if (info.sharedAcrossPattern() && info.isKeyed()) {
                sharedByPattern.putIfAbsent(info.arrayPattern(), info);
            }
        }
    }

    public static IdentityKeyIndex of(Collection<IdentityKeyInfo> entries) {
        Objects.requireNonNull(entries, "entries");
        return entries.isEmpty() ? EMPTY : new IdentityKeyIndex(entries);
    }

    public static IdentityKeyIndex empty() {
        return EMPTY;
    }

    public Optional<IdentityKeyInfo> lookup(IdentityAddress arrayAddress) {
        Objects.requireNonNull(arrayAddress, "arrayAddress");
        IdentityKeyInfo exact = byAddress.get(arrayAddress);
        if (exact != null) {
            return Optional.of(exact);
        }
        if (sharedByPattern.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(sharedByPattern.get(arrayAddress.generalize()));
    }

    public Optional<IdentityKey> keyFor(IdentityAddress arrayAddress) {
        return lookup(arrayAddress).flatMap(IdentityKeyInfo::key);
    }

    /**
     * Key in effect for the arrays matching {@code pattern}, when every recorded array of that shape
     * agrees on it.
     */
    public Optional<IdentityKey> keyForPattern(ArrayPatternAddress pattern) {
        Objects.requireNonNull(pattern, "pattern");
        IdentityKey found = null;
        for (IdentityKeyInfo info : entries) {
            if (!info.arrayPattern().equals(pattern) || !info.isKeyed()) {
                continue;
            }
            IdentityKey key = info.key().orElseThrow();
            if (found != null && !found.equals(key)) {
                return Optional.empty();
            }
            found = key;
        }
        return Optional.ofNullable(found);
    }

    public List<IdentityKeyInfo> entries() {
        return entries;
    }

    public List<IdentityKeyInfo> keyedEntries() {
        List<IdentityKeyInfo> keyed = new ArrayList<>();
        for (IdentityKeyInfo info : entries) {
            if (info.isKeyed()) {
                keyed.add(info);
            }
        }
        return keyed;
    }

    public int size() {
        return entries.size();
    }
}
