package org.pragmatica.rsfmt.shared;

import org.pragmatica.rsfmt.syntax.Span;

import java.util.Optional;

/**
 * Read-only view of the original source buffer.
 *
 * Offsets are character indices into the buffer; spans of syntax nodes refer to the same buffer.
 */
public final class SourceMap {

    private final String source;

    private SourceMap(String source) {
        this.source = source;
    }

    /**
     * Factory method.
     */
    public static SourceMap sourceMap(String source) {
        return new SourceMap(source);
    }

    public String source() {
        return source;
    }

    public int length() {
        return source.length();
    }

    /**
     * Raw text covered by the span.
     *
     * @throws IllegalArgumentException if the span lies outside the buffer
     */
    public String snippet(Span span) {
        return snippet(span.lo(), span.hi());
    }

    public String snippet(int lo, int hi) {
        if (lo < 0 || hi > source.length() || lo > hi) {
            throw new IllegalArgumentException("Span [" + lo + ", " + hi + ") is outside of source of length "
                                               + source.length());
        }
        return source.substring(lo, hi);
    }

    /**
     * Position immediately after the first occurrence of {@code needle} within the span.
     */
    public Optional<Integer> spanAfter(Span original, String needle) {
        var index = snippet(original).indexOf(needle);

        if (index < 0) {
            return Optional.empty();
        }
        return Optional.of(original.lo() + index + needle.length());
    }

    /**
     * Recovers the separator written before a generic argument list.
     *
     * Item position generics are written {@code Foo<A, B>}, expression position generics
     * {@code Foo::<A, B>}, and the tree does not keep the difference. The text between
     * {@code pathStart} and {@code segmentStart} (which ends just after the {@code <}) is
     * scanned backwards, skipping whitespace and {@code <}; a {@code :} means the list was
     * written with {@code ::}.
     * <p>
     * A comment containing {@code <} or {@code :} inside the scanned text can mislead this.
     */
    public String pathSeparator(int pathStart, int segmentStart) {
        var snippet = snippet(pathStart, segmentStart);

        for (int i = snippet.length() - 1; i >= 0; i--) {
            char c = snippet.charAt(i);

            if (c == ':') {
                return "::";
            }
            if (!Character.isWhitespace(c) && c != '<') {
                return "";
            }
        }

        return "";
    }
}
