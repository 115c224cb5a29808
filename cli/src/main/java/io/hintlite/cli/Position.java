package io.hintlite.cli;

/**
 * 1-based buffer coordinate.
 */
public record Position(int line, int column) {
    public Position {
        if (line <= 0) throw new IllegalArgumentException("line must be > 0, got " + line);
        if (column <= 0) throw new IllegalArgumentException("column must be > 0, got " + column);
    }

    /** Editor notation, {@code line.column}. */
    public String describe() {
        return line + "." + column;
    }
}
