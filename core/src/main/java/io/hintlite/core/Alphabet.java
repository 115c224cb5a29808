package io.hintlite.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Ordered, index-addressable set of symbols used to build labels.
 * <p>
 * Symbols are Unicode code points. The alphabet is immutable once built.
 * Duplicate symbols are accepted; they only make the generated labels
 * ambiguous to type, which is the caller's concern.
 */
public final class Alphabet {

    private final int[] symbols;

    private Alphabet(int[] symbols) {
        this.symbols = symbols;
    }

    /** Alphabet made of the code points of {@code keys}, in order. */
    public static Alphabet of(String keys) {
        Objects.requireNonNull(keys, "keys");
        return new Alphabet(keys.codePoints().toArray());
    }

    /** Number of symbols (k). */
    public int size() { return symbols.length; }

    public boolean isEmpty() { return symbols.length == 0; }

    /**
     * Symbol at position {@code i}.
     *
     * @throws IndexOutOfBoundsException unless 0 <= i < size()
     */
    public int symbolAt(int i) {
        Objects.checkIndex(i, symbols.length);
        return symbols[i];
    }

    /** True if {@code symbol} is one of this alphabet's symbols. */
    public boolean contains(int symbol) {
        for (int s : symbols) {
            if (s == symbol) return true;
        }
        return false;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alphabet other)) return false;
        return Arrays.equals(symbols, other.symbols);
    }

    @Override public int hashCode() { return Arrays.hashCode(symbols); }

    @Override public String toString() {
        return new String(symbols, 0, symbols.length);
    }
}
