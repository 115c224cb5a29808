package io.hintlite.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Prefix tree that grows one leaf at a time; the path to every leaf is a label.
 * <p>
 * Growth policy, applied from the root:
 *  - A node with fewer than k children gets a new leaf whose symbol is the
 *    alphabet symbol at index = current child count.
 *  - A saturated node looks at its children from last to first and picks the
 *    first one that still has room. A picked leaf is grown twice: the first
 *    step turns it into a node with one child (its old label is gone), the
 *    second adds the leaf that replaces it, so the net gain is one label.
 *  - If every child is saturated too, growth descends into the last child.
 * <p>
 * The result is deterministic and skewed to the right: with "abcd" and ten
 * labels the tree yields a, b, ca, cb, cc, cd, da, db, dc, dd. Labels stay
 * prefix-free after every growth step.
 * <p>
 * Not thread safe. A tree lives for the duration of a single generation
 * request.
 */
public final class LabelTree {

    private final Alphabet alphabet;
    private final Node root = new Node(-1); // root symbol is never part of a label
    private int leafCount;

    /**
     * @throws HintConfigurationException if the alphabet is empty
     */
    public LabelTree(Alphabet alphabet) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        if (alphabet.isEmpty()) {
            throw new HintConfigurationException("alphabet must contain at least one symbol");
        }
    }

    /**
     * Add exactly one label.
     *
     * @throws HintConfigurationException if a single-symbol alphabet already
     *         holds its only possible label
     */
    public void grow() {
        if (alphabet.size() == 1 && leafCount == 1) {
            throw new HintConfigurationException(
                    "a single-symbol alphabet can label only one target");
        }
        root.grow(alphabet);
        leafCount++;
    }

    /** Add {@code n} labels, one growth step at a time. */
    public void grow(int n) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0, got " + n);
        if (alphabet.size() == 1 && leafCount + n > 1) {
            throw new HintConfigurationException(
                    "a single-symbol alphabet can label only one target, requested " + (leafCount + n));
        }
        for (int i = 0; i < n; i++) {
            grow();
        }
    }

    /** Number of labels currently held (equals the number of growth steps). */
    public int leafCount() {
        return leafCount;
    }

    /**
     * Labels in depth-first pre-order, children visited in insertion order.
     */
    public List<Label> labels() {
        var out = new ArrayList<Label>(leafCount);
        var path = new int[depth(root)];
        for (Node child : root.children) {
            child.collect(path, 0, out);
        }
        return out;
    }

    private static int depth(Node node) {
        int max = 0;
        for (Node child : node.children) {
            max = Math.max(max, 1 + depth(child));
        }
        return max;
    }

    private static final class Node {
        private final int symbol;
        private final List<Node> children = new ArrayList<>();

        Node(int symbol) {
            this.symbol = symbol;
        }

        void grow(Alphabet alphabet) {
            int k = alphabet.size();
            if (children.size() < k) {
                children.add(new Node(alphabet.symbolAt(children.size())));
                return;
            }

            for (int i = children.size() - 1; i >= 0; i--) {
                Node child = children.get(i);
                if (child.children.size() < k) {
                    if (child.children.isEmpty()) {
                        child.grow(alphabet);
                    }
                    child.grow(alphabet);
                    return;
                }
            }

            // whole level saturated
            children.get(children.size() - 1).grow(alphabet);
        }

        void collect(int[] path, int depth, List<Label> out) {
            path[depth] = symbol;
            if (children.isEmpty()) {
                out.add(Label.ofSymbols(path, depth + 1));
                return;
            }
            for (Node child : children) {
                child.collect(path, depth + 1, out);
            }
        }
    }
}
