package io.hintlite.cli;

/**
 * A target entry on the input does not follow {@code line.column} or
 * {@code line.column,line.column}.
 */
public final class PositionParseException extends Exception {

    private final String entry;

    public PositionParseException(String entry, String reason) {
        super("malformed target '" + entry + "': " + reason);
        this.entry = entry;
    }

    public String entry() {
        return entry;
    }
}
