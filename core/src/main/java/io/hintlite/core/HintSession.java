package io.hintlite.core;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Explicit state of one hint-typing interaction, held by the caller.
 * <p>
 * States:
 *  - Active:    candidates are on screen, waiting for the next symbol.
 *  - Resolved:  exactly one target is left and it is selected.
 *  - Cancelled: the abort symbol was typed.
 *  - Exhausted: the typed symbol matched no candidate.
 * <p>
 * {@link #advance(int)} moves an Active session by one symbol. Resolved,
 * Cancelled and Exhausted are terminal and reject further symbols.
 */
public sealed interface HintSession<T>
        permits HintSession.Active, HintSession.Resolved, HintSession.Cancelled, HintSession.Exhausted {

    /**
     * Label the targets and open a session over them. Without targets there
     * is nothing to type, so the session starts Exhausted.
     *
     * @throws HintConfigurationException if the assigner's alphabet cannot
     *         label that many targets, or contains the abort symbol
     */
    static <T> HintSession<T> start(LabelAssigner assigner, ReductionEngine engine, List<T> targets) {
        Objects.requireNonNull(assigner, "assigner");
        Objects.requireNonNull(engine, "engine");
        engine.requireDistinctFrom(assigner.alphabet());
        List<Hint<T>> hints = assigner.assign(targets);
        if (hints.isEmpty()) {
            return new Exhausted<>();
        }
        return new Active<>(hints, engine);
    }

    /**
     * Feed one typed symbol.
     *
     * @throws IllegalStateException if this session is already terminal
     */
    HintSession<T> advance(int symbol);

    default boolean isTerminal() {
        return !(this instanceof Active);
    }

    record Active<T>(List<Hint<T>> candidates, ReductionEngine engine) implements HintSession<T> {
        private static final Logger log = Logger.getLogger(HintSession.class.getName());

        public Active {
            candidates = List.copyOf(candidates);
            if (candidates.isEmpty()) {
                throw new IllegalArgumentException("an active session needs at least one candidate");
            }
            Objects.requireNonNull(engine, "engine");
        }

        @Override
        public HintSession<T> advance(int symbol) {
            ReductionOutcome<T> outcome = engine.reduce(candidates, symbol);
            HintSession<T> next;
            if (outcome instanceof ReductionOutcome.Reduced<T> reduced) {
                List<Hint<T>> left = reduced.candidates();
                if (left.isEmpty()) {
                    next = new Exhausted<>();
                } else if (left.size() == 1) {
                    next = new Resolved<>(left.get(0).target());
                } else {
                    next = new Active<>(left, engine);
                }
            } else {
                next = new Cancelled<>();
            }
            log.fine(() -> String.format("U+%04X", symbol) + ": " + candidates.size() + " candidates -> " + next.getClass().getSimpleName());
            return next;
        }
    }

    record Resolved<T>(T target) implements HintSession<T> {
        public Resolved {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public HintSession<T> advance(int symbol) {
            throw new IllegalStateException("session already resolved to " + target);
        }
    }

    record Cancelled<T>() implements HintSession<T> {
        @Override
        public HintSession<T> advance(int symbol) {
            throw new IllegalStateException("session was cancelled");
        }
    }

    record Exhausted<T>() implements HintSession<T> {
        @Override
        public HintSession<T> advance(int symbol) {
            throw new IllegalStateException("no hint matched, session is over");
        }
    }
}
