package io.hintlite.cli.format;

import io.hintlite.cli.GraphemeTruncator;
import io.hintlite.cli.Position;
import io.hintlite.cli.Selection;
import io.hintlite.core.Hint;

import java.util.List;

/**
 * Line-oriented output: {@code line column hint} triples while hints are on
 * screen, {@code line column} once resolved.
 */
public final class PlainFormatter implements HintFormatter {

    private final GraphemeTruncator truncator;

    public PlainFormatter(GraphemeTruncator truncator) {
        this.truncator = truncator;
    }

    @Override
    public String hints(List<Hint<Selection>> hints) {
        var sb = new StringBuilder();
        for (Hint<Selection> hint : hints) {
            Position at = hint.target().cursor();
            sb.append(at.line()).append(' ')
                    .append(at.column()).append(' ')
                    .append(truncator.truncate(hint.label().toString()))
                    .append('\n');
        }
        return sb.toString();
    }

    @Override
    public String resolved(Selection target) {
        Position at = target.cursor();
        return at.line() + " " + at.column() + "\n";
    }

    @Override
    public String cancelled() {
        return "cancelled\n";
    }

    @Override
    public String noMatch() {
        return "no-match\n";
    }
}
