package org.jsondelta.path;

import java.util.Objects;

/**
 * A position address bound to one of the two compared documents, written {@code left:items[0]}.
 */
public final class ScopedAddress {
    private final Side side;
    private final PositionAddress address;

    private ScopedAddress(Side side, PositionAddress address) {
        this.side = Objects.requireNonNull(side, "side");
        this.address = Objects.requireNonNull(address, "address");
    }

    public static ScopedAddress of(Side side, PositionAddress address) {
        return new ScopedAddress(side, address);
    }

    public static ScopedAddress left(PositionAddress address) {
        return new ScopedAddress(Side.LEFT, address);
    }

    public static ScopedAddress right(PositionAddress address) {
        return new ScopedAddress(Side.RIGHT, address);
    }

    public static ScopedAddress parse(String text) {
        Objects.requireNonNull(text, "text");
        int colon = text.indexOf(':');
        if (colon < 0) {
            throw new AddressSyntaxException(text, 0, "scoped address needs a side prefix");
        }
        Side side;
        try {
            side = Side.fromTag(text.substring(0, colon));
        } catch (IllegalArgumentException e) {
            throw new AddressSyntaxException(text, 1, "side must be 'left' or 'right'");
        }
        return new ScopedAddress(side, PositionAddress.parse(text.substring(colon + 1)));
    }

    public Side side() {
        return side;
    }

    public PositionAddress address() {
        return address;
    }

    public String text() {
        return side.tag() + ":" + address.text();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ScopedAddress that)) {
            return false;
        }
        return side == that.side && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(side, address);
    }

    @Override
    public String toString() {
        return text();
    }
}
