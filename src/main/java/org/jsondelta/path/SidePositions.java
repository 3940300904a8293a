package org.jsondelta.path;

import java.util.Objects;
import java.util.Optional;

/**
 * Where one identity address lands in each document.
 */
public record SidePositions(Optional<PositionAddress> left, Optional<PositionAddress> right) {
    public SidePositions {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    public Optional<PositionAddress> get(Side side) {
        return side == Side.LEFT ? left : right;
    }

    public Optional<ScopedAddress> scoped(Side side) {
        return get(side).map(address -> ScopedAddress.of(side, address));
    }

    public boolean presentOnBoth() {
        return left.isPresent() && right.isPresent();
    }

    public boolean absentOnBoth() {
        return left.isEmpty() && right.isEmpty();
    }
}
