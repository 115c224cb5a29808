package io.hintlite.cli.format;

import io.hintlite.cli.Selection;
import io.hintlite.core.Hint;

import java.util.List;

/**
 * Renders session states for the host.
 * <p>
 * Implementations only format; they never decide what state the session is
 * in. Every method returns the complete text to write, trailing newline
 * included when non-empty.
 */
public interface HintFormatter {

    /** Hints still on screen, labels holding the symbols left to type. */
    String hints(List<Hint<Selection>> hints);

    /** A single target was selected. */
    String resolved(Selection target);

    /** The user pressed the abort key. */
    String cancelled();

    /** The last typed key matched no hint. */
    String noMatch();
}
