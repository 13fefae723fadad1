package org.pragmatica.rsfmt.format.rewrite;

/**
 * Offset into the source up to which the text of a path has been accounted for.
 *
 * Only moves forward. One cursor is used per path render.
 */
public final class SpanCursor {

    private int position;

    private SpanCursor(int position) {
        this.position = position;
    }

    public static SpanCursor spanCursor(int start) {
        return new SpanCursor(start);
    }

    public int position() {
        return position;
    }

    public void advanceTo(int newPosition) {
        position = Math.max(position, newPosition);
    }
}
