package io.hintlite.core;

import java.util.Arrays;

/**
 * Immutable sequence of symbols identifying one target.
 * <p>
 * While hints are being typed, a label also represents the part of the
 * original label that is still left to type; {@link #tail()} drops the
 * symbol that has just been matched.
 */
public final class Label {

    private static final Label EMPTY = new Label(new int[0]);

    private final int[] symbols;

    private Label(int[] symbols) {
        this.symbols = symbols;
    }

    public static Label of(String text) {
        return new Label(text.codePoints().toArray());
    }

    static Label ofSymbols(int[] symbols, int length) {
        return new Label(Arrays.copyOf(symbols, length));
    }

    public int length() { return symbols.length; }

    public boolean isEmpty() { return symbols.length == 0; }

    public int symbolAt(int i) {
        return symbols[i];
    }

    /** First symbol still to type. */
    public int head() {
        if (symbols.length == 0) throw new IllegalStateException("empty label has no head");
        return symbols[0];
    }

    /** This label without its first symbol. */
    public Label tail() {
        if (symbols.length == 0) throw new IllegalStateException("empty label has no tail");
        return symbols.length == 1 ? EMPTY : new Label(Arrays.copyOfRange(symbols, 1, symbols.length));
    }

    /** True if {@code other} starts with every symbol of this label. */
    public boolean isPrefixOf(Label other) {
        if (symbols.length > other.symbols.length) return false;
        return Arrays.equals(symbols, 0, symbols.length, other.symbols, 0, symbols.length);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Label other)) return false;
        return Arrays.equals(symbols, other.symbols);
    }

    @Override public int hashCode() { return Arrays.hashCode(symbols); }

    @Override public String toString() {
        return new String(symbols, 0, symbols.length);
    }
}
