package io.hintlite.cli;

import java.text.BreakIterator;

/**
 * Cuts display strings to a number of user-perceived characters.
 * <p>
 * Boundaries come from {@link BreakIterator#getCharacterInstance()}, so a
 * base letter and its combining marks, or a surrogate pair, are kept or
 * dropped together.
 */
public final class GraphemeTruncator {

    private final int maxClusters;

    /**
     * @param maxClusters maximum number of clusters to keep; 0 keeps everything
     */
    public GraphemeTruncator(int maxClusters) {
        if (maxClusters < 0) throw new IllegalArgumentException("maxClusters must be >= 0, got " + maxClusters);
        this.maxClusters = maxClusters;
    }

    public String truncate(String text) {
        if (maxClusters == 0 || text.length() <= maxClusters) {
            return text;
        }
        BreakIterator it = BreakIterator.getCharacterInstance();
        it.setText(text);
        int end = it.first();
        for (int kept = 0; kept < maxClusters; kept++) {
            int next = it.next();
            if (next == BreakIterator.DONE) {
                return text;
            }
            end = next;
        }
        return text.substring(0, end);
    }

    /** Number of clusters in {@code text}. */
    public static int clusterCount(String text) {
        BreakIterator it = BreakIterator.getCharacterInstance();
        it.setText(text);
        int count = 0;
        it.first();
        while (it.next() != BreakIterator.DONE) {
            count++;
        }
        return count;
    }
}
