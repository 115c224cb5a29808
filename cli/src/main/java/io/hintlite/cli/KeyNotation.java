package io.hintlite.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Key names as the host spells them: plain characters, plus {@code <esc>}
 * for the escape key.
 */
final class KeyNotation {

    static final String ESC_NAME = "<esc>";
    static final int ESC = 0x1B;

    private KeyNotation() {
        // utility
    }

    /** Code points of {@code keys}, with every {@code <esc>} read as one escape. */
    static List<Integer> parse(String keys) {
        var out = new ArrayList<Integer>();
        int i = 0;
        while (i < keys.length()) {
            if (keys.regionMatches(true, i, ESC_NAME, 0, ESC_NAME.length())) {
                out.add(ESC);
                i += ESC_NAME.length();
            } else {
                int cp = keys.codePointAt(i);
                out.add(cp);
                i += Character.charCount(cp);
            }
        }
        return out;
    }

    /**
     * Exactly one key.
     *
     * @throws IllegalArgumentException if {@code key} names zero or several keys
     */
    static int single(String key) {
        List<Integer> keys = parse(key);
        if (keys.size() != 1) {
            throw new IllegalArgumentException("expected a single key, got '" + key + "'");
        }
        return keys.get(0);
    }
}
