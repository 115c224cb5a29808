package io.hintlite.cli.format;

import io.hintlite.cli.GraphemeTruncator;

import java.util.Locale;

/**
 * Output formats selectable with {@code --format}.
 */
public enum OutputFormat {
    PLAIN, JSON, KAK;

    public HintFormatter formatter(GraphemeTruncator truncator) {
        return switch (this) {
            case PLAIN -> new PlainFormatter(truncator);
            case JSON -> new JsonFormatter(truncator);
            case KAK -> new KakouneFormatter(truncator);
        };
    }

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    public static OutputFormat parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown format: " + name + " (expected plain, json or kak)");
        }
    }
}
