package org.pragmatica.rsfmt.syntax;

/**
 * Half-open range {@code [lo, hi)} of character offsets into the original source buffer.
 */
public record Span(int lo, int hi) {

    public Span {
        if (lo < 0 || hi < lo) {
            throw new IllegalArgumentException("Invalid span [" + lo + ", " + hi + ")");
        }
    }

    /**
     * Factory method.
     */
    public static Span span(int lo, int hi) {
        return new Span(lo, hi);
    }

    public int length() {
        return hi - lo;
    }
}
