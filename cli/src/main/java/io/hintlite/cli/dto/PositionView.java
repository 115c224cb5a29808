package io.hintlite.cli.dto;

/**
 * JSON form of a buffer position.
 * Example:
 *   { "line": 12, "column": 5 }
 */
public class PositionView {
    public int line;
    public int column;

    public PositionView() {
    }

    public PositionView(int line, int column) {
        this.line = line;
        this.column = column;
    }
}
