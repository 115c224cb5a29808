package io.hintlite.cli.format;

import io.hintlite.cli.GraphemeTruncator;
import io.hintlite.cli.Position;
import io.hintlite.cli.Selection;
import io.hintlite.core.Hint;

import java.util.List;

/**
 * Kakoune commands, meant to be evaluated by the editor as-is.
 * <p>
 * Hints are drawn through the {@code hintlite_hints} range-specs option that
 * the init script declares; each label replaces the buffer text at its
 * target's cursor.
 * <p>
 * Kakoune reads the length after {@code +} over the buffer text being
 * replaced. The buffer is never seen here, so the length is the label's
 * character count: a label drawn over multi-byte or wide buffer text may
 * cover a little more or less than its own width.
 */
public final class KakouneFormatter implements HintFormatter {

    static final String OPTION = "hintlite_hints";
    static final String FACE = "HintliteLabel";

    private final GraphemeTruncator truncator;

    public KakouneFormatter(GraphemeTruncator truncator) {
        this.truncator = truncator;
    }

    @Override
    public String hints(List<Hint<Selection>> hints) {
        var sb = new StringBuilder("set-option window ").append(OPTION).append(" %val{timestamp}");
        for (Hint<Selection> hint : hints) {
            String label = truncator.truncate(hint.label().toString());
            Position at = hint.target().cursor();
            String rangeSpec = at.describe() + "+" + GraphemeTruncator.clusterCount(label) + "|{" + FACE + "}" + label;
            sb.append(' ').append(quote(rangeSpec));
        }
        return sb.append('\n').toString();
    }

    @Override
    public String resolved(Selection target) {
        return "hintlite-leave\nselect " + target.describe() + "\n";
    }

    @Override
    public String cancelled() {
        return "hintlite-leave\n";
    }

    @Override
    public String noMatch() {
        return "hintlite-leave\necho -markup '{Error}no hint matches'\n";
    }

    /** Single-quoted Kakoune string; embedded quotes are doubled. */
    static String quote(String s) {
        return "'" + s.replace("'", "''") + "'";
    }
}
