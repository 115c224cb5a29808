package io.hintlite.core;

/**
 * Hint generation cannot run with the supplied configuration,
 * for example because the alphabet has no symbols.
 */
public final class HintConfigurationException extends IllegalArgumentException {

    public HintConfigurationException(String message) {
        super(message);
    }
}
