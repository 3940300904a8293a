package org.jsondelta.path;

import java.util.Objects;
import java.util.Optional;

/**
 * What detection decided for one array location: the key (if any), where the array sits, and how
 * large it was on each side.
 */
public final class IdentityKeyInfo {
    private final ScopedAddress arrayAddress;
    private final IdentityAddress arrayIdentityAddress;
    private final IdentityKey key;
    private final int sizeLeft;
    private final int sizeRight;
    private final boolean sharedAcrossPattern;

    public IdentityKeyInfo(
        ScopedAddress arrayAddress,
        IdentityAddress arrayIdentityAddress,
        IdentityKey key,
        int sizeLeft,
        int sizeRight,
        boolean sharedAcrossPattern) {
        this.arrayAddress = Objects.requireNonNull(arrayAddress, "arrayAddress");
        this.arrayIdentityAddress = Objects.requireNonNull(arrayIdentityAddress, "arrayIdentityAddress");
        this.key = key;
        if (sizeLeft < 0 || sizeRight < 0) {
            throw new IllegalArgumentException("array sizes must not be negative");
        }
        this.sizeLeft = sizeLeft;
        this.sizeRight = sizeRight;
        this.sharedAcrossPattern = sharedAcrossPattern;
    }

    /**
     * Concrete location of the array, on the left document when it exists there.
     */
    public ScopedAddress arrayAddress() {
        return arrayAddress;
    }

    public IdentityAddress arrayIdentityAddress() {
        return arrayIdentityAddress;
    }

    /**
     * Empty when the array is compared positionally.
     */
    public Optional<IdentityKey> key() {
        return Optional.ofNullable(key);
    }

    public boolean isKeyed() {
        return key != null;
    }

    public boolean isComposite() {
        return key != null && key.isComposite();
    }

    public int sizeLeft() {
        return sizeLeft;
    }

    public int sizeRight() {
        return sizeRight;
    }

    /**
     * True when the key was chosen once for the array pattern and reused for every array matching it.
     */
    public boolean sharedAcrossPattern() {
        return sharedAcrossPattern;
    }

    public ArrayPatternAddress arrayPattern() {
        return arrayIdentityAddress.generalize();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof IdentityKeyInfo that)) {
            return false;
        }
        return sizeLeft == that.sizeLeft
            && sizeRight == that.sizeRight
            && sharedAcrossPattern == that.sharedAcrossPattern
            && arrayAddress.equals(that.arrayAddress)
            && arrayIdentityAddress.equals(that.arrayIdentityAddress)
            && Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(arrayAddress, arrayIdentityAddress, key, sizeLeft, sizeRight, sharedAcrossPattern);
    }

    @Override
    public String toString() {
        return "IdentityKeyInfo{"
            + "array=" + arrayIdentityAddress.text()
            + ", key=" + (key == null ? "<positional>" : key.displayName())
            + ", sizes=" + sizeLeft + "/" + sizeRight
            + (sharedAcrossPattern ? ", shared" : "")
            + '}';
    }
}
