package eu.virtualparadox.docindex.ingest.chunker;

/**
 * Immutable half-open span {@code [start, end)} pointing into the unit text.
 * Used to reference paragraphs, sentences and fixed-size windows.
 */
final class TextSpan {
    /**
     * Inclusive start offset into the unit text.
     */
    final int start;
    /**
     * Exclusive end offset into the unit text.
     */
    final int end;

    /**
     * Creates a span.
     *
     * @param start inclusive start index (0 ≤ start ≤ end)
     * @param end   exclusive end index (start ≤ end ≤ text length)
     */
    TextSpan(final int start, final int end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Length of the span in characters.
     *
     * @return {@code end - start}
     */
    int length() {
        return end - start;
    }

    /**
     * Smallest span covering this span and {@code other}.
     */
    TextSpan union(final TextSpan other) {
        return new TextSpan(Math.min(start, other.start), Math.max(end, other.end));
    }
}
