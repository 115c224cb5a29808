package io.hintlite.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Narrows a candidate set by one typed symbol.
 * <p>
 * Pure function over its inputs: the engine keeps no state between calls and
 * never throws for an unexpected symbol. Whatever the user types yields a
 * {@link ReductionOutcome}.
 */
public final class ReductionEngine {

    /** Escape, the default abort symbol. */
    public static final int DEFAULT_ABORT_SYMBOL = 0x1B;

    private final int abortSymbol;

    public ReductionEngine() {
        this(DEFAULT_ABORT_SYMBOL);
    }

    public ReductionEngine(int abortSymbol) {
        this.abortSymbol = abortSymbol;
    }

    public int abortSymbol() {
        return abortSymbol;
    }

    /**
     * Check that the abort symbol cannot be confused with a label symbol.
     *
     * @throws HintConfigurationException if {@code alphabet} contains the abort symbol
     */
    public void requireDistinctFrom(Alphabet alphabet) {
        if (alphabet.contains(abortSymbol)) {
            throw new HintConfigurationException(String.format(
                    "abort key U+%04X is also a hint key in \"%s\"", abortSymbol, alphabet));
        }
    }

    /**
     * Keep the candidates whose remaining label starts with {@code typedSymbol}
     * and strip that symbol from them, or cancel on the abort symbol.
     */
    public <T> ReductionOutcome<T> reduce(List<Hint<T>> candidates, int typedSymbol) {
        Objects.requireNonNull(candidates, "candidates");
        if (typedSymbol == abortSymbol) {
            return new ReductionOutcome.Cancelled<>();
        }

        var survivors = new ArrayList<Hint<T>>();
        for (Hint<T> hint : candidates) {
            Label rest = hint.label();
            if (!rest.isEmpty() && rest.head() == typedSymbol) {
                survivors.add(hint.consumeHead());
            }
        }
        return new ReductionOutcome.Reduced<>(survivors);
    }
}
