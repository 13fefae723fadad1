package org.pragmatica.rsfmt.format.rewrite;

import java.util.Optional;

/**
 * Rendering budget: the width still available and the column at which rendering starts.
 *
 * All reductions are checked; running out of width yields {@link Optional#empty()}.
 */
public record Shape(int width, int offset) {

    public Shape {
        if (width < 0 || offset < 0) {
            throw new IllegalArgumentException("Invalid shape: width " + width + ", offset " + offset);
        }
    }

    /**
     * Factory method.
     */
    public static Shape shape(int width, int offset) {
        return new Shape(width, offset);
    }

    /**
     * Shape for text that continues {@code used} columns further right on the same line.
     */
    public Optional<Shape> consume(int used) {
        return used > width ? Optional.empty() : Optional.of(new Shape(width - used, offset + used));
    }

    /**
     * Shape with {@code used} columns kept free at the end of the line; the start column is unchanged.
     */
    public Optional<Shape> reserve(int used) {
        return used > width ? Optional.empty() : Optional.of(new Shape(width - used, offset));
    }

    /**
     * Shape for text following {@code emitted}, where {@code emitted} was rendered starting at this shape's offset.
     */
    public Optional<Shape> after(String emitted) {
        return consume(extraOffset(emitted, offset));
    }

    /**
     * Columns occupied by {@code text} past {@code offset} on its last line.
     * Continuation lines of multi-line text carry their absolute indentation.
     */
    public static int extraOffset(String text, int offset) {
        var newline = text.lastIndexOf('\n');

        if (newline < 0) {
            return text.length();
        }
        return Math.max(0, text.length() - newline - 1 - offset);
    }
}
