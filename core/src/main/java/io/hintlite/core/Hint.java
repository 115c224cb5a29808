package io.hintlite.core;

import java.util.Objects;

/**
 * A label paired with the target it selects.
 * <p>
 * During reduction the label holds only the symbols that are still left to
 * type; the target never changes.
 *
 * @param <T> caller-defined target identity, never interpreted here
 */
public record Hint<T>(Label label, T target) {

    public Hint {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(target, "target");
    }

    /** Same target, label without its first symbol. */
    public Hint<T> consumeHead() {
        return new Hint<>(label.tail(), target);
    }
}
