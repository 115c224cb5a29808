package io.hintlite.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assigns one prefix-free label to each target.
 * <p>
 * Every call builds a fresh {@link LabelTree}, grows it once per target and
 * pairs the labels (tree pre-order) with the targets (input order): the first
 * label goes to the first target, and so on. Same alphabet and same target
 * count always give the same labels.
 */
public final class LabelAssigner {
    private static final Logger log = Logger.getLogger(LabelAssigner.class.getName());

    private final Alphabet alphabet;

    public LabelAssigner(Alphabet alphabet) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    /**
     * Generate {@code count} labels in traversal order.
     *
     * @throws HintConfigurationException if count > 0 and the alphabet cannot
     *         hold that many labels (empty, or a single symbol for count > 1)
     */
    public List<Label> labels(int count) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0, got " + count);
        if (count == 0) return List.of();

        var tree = new LabelTree(alphabet);
        tree.grow(count);
        List<Label> labels = tree.labels();

        if (log.isLoggable(Level.FINE)) {
            log.fine(String.format("grew %d labels over alphabet \"%s\"", labels.size(), alphabet));
        }
        return labels;
    }

    /**
     * Pair each target with its label.
     *
     * @param targets targets in display order; null elements are rejected
     * @return hints in the same order as {@code targets}
     */
    public <T> List<Hint<T>> assign(List<T> targets) {
        Objects.requireNonNull(targets, "targets");
        List<Label> labels = labels(targets.size());

        var hints = new ArrayList<Hint<T>>(targets.size());
        for (int i = 0; i < targets.size(); i++) {
            hints.add(new Hint<>(labels.get(i), targets.get(i)));
        }
        return List.copyOf(hints);
    }
}
