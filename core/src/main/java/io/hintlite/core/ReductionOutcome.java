package io.hintlite.core;

import java.util.List;

/**
 * Result of feeding one typed symbol to a candidate set.
 * <p>
 *  - Cancelled: the abort symbol was typed; every candidate is discarded.
 *  - Reduced:   the candidates whose remaining label started with the typed
 *               symbol, with that symbol stripped. An empty list means no hint
 *               matched, a single element means the target is selected, more
 *               than one means the user has to keep typing.
 */
public sealed interface ReductionOutcome<T> permits ReductionOutcome.Cancelled, ReductionOutcome.Reduced {

    record Cancelled<T>() implements ReductionOutcome<T> {}

    record Reduced<T>(List<Hint<T>> candidates) implements ReductionOutcome<T> {
        public Reduced {
            candidates = List.copyOf(candidates);
        }

        public boolean isNoMatch() { return candidates.isEmpty(); }

        public boolean isResolved() { return candidates.size() == 1; }
    }
}
