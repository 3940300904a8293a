package org.jsondelta.engine;

import java.util.Objects;
import java.util.Optional;
import org.jsondelta.path.ArrayPatternAddress;
import org.jsondelta.path.IdentityAddress;
import org.jsondelta.path.IdentityKey;
import org.jsondelta.path.PositionAddress;
import org.jsondelta.path.ScopedAddress;
import org.jsondelta.path.Side;
import org.jsondelta.value.JsonValue;

/**
 * One difference between the two documents, addressed both by identity and by position on each side
 * where the node exists.
 */
public final class DiffRecord {
    private final DiffKind kind;
    private final IdentityAddress identityAddress;
    private final PositionAddress leftAddress;
    private final PositionAddress rightAddress;
    private final JsonValue oldValue;
    private final JsonValue newValue;
    private final IdentityKey identityKey;

    private DiffRecord(
        DiffKind kind,
        IdentityAddress identityAddress,
        PositionAddress leftAddress,
        PositionAddress rightAddress,
        JsonValue oldValue,
        JsonValue newValue,
        IdentityKey identityKey) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.identityAddress = Objects.requireNonNull(identityAddress, "identityAddress");
        this.leftAddress = leftAddress;
        this.rightAddress = rightAddress;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.identityKey = identityKey;
        switch (kind) {
            case ADDED -> require(oldValue == null && leftAddress == null && newValue != null && rightAddress != null);
            case REMOVED -> require(newValue == null && rightAddress == null && oldValue != null && leftAddress != null);
            case CHANGED -> require(oldValue != null && newValue != null && leftAddress != null && rightAddress != null);
        }
    }

    public static DiffRecord added(
        IdentityAddress identityAddress, PositionAddress rightAddress, JsonValue newValue, IdentityKey identityKey) {
        return new DiffRecord(DiffKind.ADDED, identityAddress, null, rightAddress, null, newValue, identityKey);
    }

    public static DiffRecord removed(
        IdentityAddress identityAddress, PositionAddress leftAddress, JsonValue oldValue, IdentityKey identityKey) {
        return new DiffRecord(DiffKind.REMOVED, identityAddress, leftAddress, null, oldValue, null, identityKey);
    }

    public static DiffRecord changed(
        IdentityAddress identityAddress,
        PositionAddress leftAddress,
        PositionAddress rightAddress,
        JsonValue oldValue,
        JsonValue newValue,
        IdentityKey identityKey) {
        return new DiffRecord(
            DiffKind.CHANGED, identityAddress, leftAddress, rightAddress, oldValue, newValue, identityKey);
    }

    public DiffKind kind() {
        return kind;
    }

    public IdentityAddress identityAddress() {
        return identityAddress;
    }

    public Optional<PositionAddress> leftAddress() {
        return Optional.ofNullable(leftAddress);
    }

    public Optional<PositionAddress> rightAddress() {
        return Optional.ofNullable(rightAddress);
    }

    public Optional<PositionAddress> address(Side side) {
        return side == Side.LEFT ? leftAddress() : rightAddress();
    }

    public Optional<ScopedAddress> scopedAddress(Side side) {
        return address(side).map(address -> ScopedAddress.of(side, address));
    }

    public Optional<JsonValue> oldValue() {
        return Optional.ofNullable(oldValue);
    }

    public Optional<JsonValue> newValue() {
        return Optional.ofNullable(newValue);
    }

    /**
     * Key of the enclosing array when this record names an element of a keyed array.
     */
    public Optional<IdentityKey> identityKey() {
        return Optional.ofNullable(identityKey);
    }

    public ArrayPatternAddress arrayPattern() {
        return identityAddress.generalize();
    }

    /**
     * The same difference as reported by a comparison with left and right swapped.
     */
    public DiffRecord mirrored() {
        return new DiffRecord(
            kind.mirror(), identityAddress, rightAddress, leftAddress, newValue, oldValue, identityKey);
    }

    private static void require(boolean condition) {
        if (!condition) {
            throw new IllegalArgumentException("inconsistent addresses or values for diff kind");
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DiffRecord that)) {
            return false;
        }
        return kind == that.kind
            && identityAddress.equals(that.identityAddress)
            && Objects.equals(leftAddress, that.leftAddress)
            && Objects.equals(rightAddress, that.rightAddress)
            && Objects.equals(oldValue, that.oldValue)
            && Objects.equals(newValue, that.newValue)
            && Objects.equals(identityKey, that.identityKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, identityAddress, leftAddress, rightAddress, oldValue, newValue, identityKey);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder()
            .append(kind)
            .append(' ')
            .append(identityAddress.isRoot() ? "<root>" : identityAddress.text());
        if (oldValue != null) {
            sb.append(" old=").append(oldValue);
        }
        if (newValue != null) {
            sb.append(" new=").append(newValue);
        }
        return sb.toString();
    }
}
