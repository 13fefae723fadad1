package org.pragmatica.rsfmt.format.lists;

import org.pragmatica.rsfmt.shared.SourceMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Turns spanned syntax elements into {@link ListItem}s, recovering the comments written between them.
 */
public final class ListItems {

    private ListItems() {}

    /**
     * Itemize a list of elements.
     *
     * @param sourceMap      source buffer the spans refer to
     * @param elements       elements in source order
     * @param separator      separator written between elements in the source
     * @param terminator     token closing the list in the source
     * @param lo             start offset of an element
     * @param hi             end offset of an element
     * @param text           pre-rendered text of an element
     * @param prevSpanEnd    offset just past the list opener
     * @param nextSpanStart  offset no comment of the last element may extend beyond
     * @return items in source order
     */
    public static <T> List<ListItem> itemize(SourceMap sourceMap,
                                             List<T> elements,
                                             String separator,
                                             String terminator,
                                             ToIntFunction<T> lo,
                                             ToIntFunction<T> hi,
                                             Function<T, String> text,
                                             int prevSpanEnd,
                                             int nextSpanStart) {
        var result = new ArrayList<ListItem>(elements.size());

        for (int i = 0; i < elements.size(); i++) {
            var element = elements.get(i);
            var elementLo = lo.applyAsInt(element);
            var elementHi = hi.applyAsInt(element);
            var hasNext = i + 1 < elements.size();

            // The separator may open the line of the next element: "A\n    , B".
            var preSnippet = gap(sourceMap, prevSpanEnd, elementLo).strip();
            var preComment = comment(stripSeparator(preSnippet, separator).strip());

            var nextStart = hasNext ? lo.applyAsInt(elements.get(i + 1)) : nextSpanStart;
            var postSnippet = gap(sourceMap, elementHi, nextStart);
            var commentEnd = hasNext
                             ? commentEndBeforeNext(postSnippet, separator)
                             : commentEndBeforeTerminator(postSnippet, terminator);

            prevSpanEnd = elementHi + commentEnd;

            result.add(new ListItem(preComment,
                                    text.apply(element),
                                    comment(stripSeparator(postSnippet.substring(0, commentEnd).strip(), separator))));
        }

        return result;
    }

    private static String gap(SourceMap sourceMap, int lo, int hi) {
        return lo < hi ? sourceMap.snippet(lo, hi) : "";
    }

    private static int commentEndBeforeNext(String postSnippet, String separator) {
        var blockStart = Comments.before(postSnippet, "/*", "\n");

        if (blockStart >= 0) {
            // Block comment on the same line, either before or after the separator.
            var separatorIndex = Comments.findUncommented(postSnippet, separator);
            var afterSeparator = separatorIndex < 0 ? 0 : separatorIndex + separator.length();
            return Math.max(Comments.blockCommentEnd(postSnippet, blockStart), afterSeparator);
        }

        var newline = postSnippet.indexOf('\n');
        return newline < 0 ? postSnippet.length() : newline + 1;
    }

    private static int commentEndBeforeTerminator(String postSnippet, String terminator) {
        var index = Comments.findUncommented(postSnippet, terminator);
        return index < 0 ? postSnippet.length() : index;
    }

    private static String stripSeparator(String snippet, String separator) {
        if (snippet.startsWith(separator)) {
            return stripBlanks(snippet.substring(separator.length()));
        }
        if (snippet.endsWith(separator)) {
            return stripBlanks(snippet.substring(0, snippet.length() - separator.length()));
        }
        return snippet;
    }

    private static String stripBlanks(String text) {
        int start = 0;
        int end = text.length();

        while (start < end && isBlank(text.charAt(start))) {
            start++;
        }
        while (end > start && isBlank(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }

    private static Optional<String> comment(String text) {
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
