package org.jsondelta.path;

/**
 * Rejects malformed address or pattern text at construction time.
 */
public final class AddressSyntaxException extends IllegalArgumentException {
    private final String input;
    private final int column;

    public AddressSyntaxException(final String input, final int column, final String message) {
        super(message + (column > 0 ? " at column " + column : "") + ": \"" + input + "\"");
        this.input = input;
        this.column = column;
    }

    public String input() {
        return input;
    }

    /**
     * One-based column of the offending character, or {@code 0} when the whole input is at fault.
     */
    public int column() {
        return column;
    }
}
