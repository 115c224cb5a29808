package io.hintlite.cli;

import java.util.Objects;

/**
 * A selectable target: anchor and cursor. A plain position is a selection
 * whose anchor and cursor coincide.
 */
public record Selection(Position anchor, Position cursor) {
    public Selection {
        Objects.requireNonNull(anchor, "anchor");
        Objects.requireNonNull(cursor, "cursor");
    }

    public static Selection at(Position position) {
        return new Selection(position, position);
    }

    public boolean isCollapsed() {
        return anchor.equals(cursor);
    }

    /** Editor selection descriptor, {@code a.b,c.d}. */
    public String describe() {
        return anchor.describe() + "," + cursor.describe();
    }
}
