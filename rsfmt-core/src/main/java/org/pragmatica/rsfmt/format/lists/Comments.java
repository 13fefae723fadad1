package org.pragmatica.rsfmt.format.lists;

/**
 * Helpers for locating comments in raw source snippets.
 */
final class Comments {

    private Comments() {}

    /**
     * Index of the first {@code pattern} occurrence outside of comments, or -1.
     */
    static int findUncommented(String text, String pattern) {
        int i = 0;

        while (i < text.length()) {
            if (text.startsWith("/*", i)) {
                i = blockCommentEnd(text, i);
            } else if (text.startsWith("//", i)) {
                var newline = text.indexOf('\n', i);
                i = newline < 0 ? text.length() : newline + 1;
            } else if (text.startsWith(pattern, i)) {
                return i;
            } else {
                i++;
            }
        }

        return -1;
    }

    /**
     * Index just past the block comment which starts at {@code start}.
     * An unterminated comment extends to the end of the text.
     */
    static int blockCommentEnd(String text, int start) {
        var end = text.indexOf("*/", start + 2);
        return end < 0 ? text.length() : end + 2;
    }

    /**
     * Index of {@code pattern} when it occurs before the first {@code limit}, or -1.
     */
    static int before(String text, String pattern, String limit) {
        var index = text.indexOf(pattern);

        if (index < 0) {
            return -1;
        }

        var limitIndex = text.indexOf(limit);
        return limitIndex < 0 || index < limitIndex ? index : -1;
    }

    static boolean isLineComment(String comment) {
        return comment.startsWith("//");
    }

    /**
     * Turns {@code // text} into {@code /* text *}{@code /}; other comments are returned unchanged.
     */
    static String toBlockComment(String comment) {
        if (!isLineComment(comment)) {
            return comment;
        }
        return "/* " + comment.substring(2).strip() + " */";
    }
}
