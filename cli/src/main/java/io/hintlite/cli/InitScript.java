package io.hintlite.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Kakoune script that wires the editor to this program, bundled on the
 * classpath.
 */
public final class InitScript {

    static final String RESOURCE = "/io/hintlite/cli/hintlite.kak";

    private InitScript() {
        // utility
    }

    public static String text() {
        try (InputStream in = InitScript.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("missing classpath resource " + RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }
}
