package org.pragmatica.rsfmt.format.lists;

/**
 * Parameters of a single list layout.
 *
 * @param tactic             layout policy
 * @param separator          text written after every item except (depending on {@code trailingSeparator}) the last
 * @param trailingSeparator  policy for the separator after the last item
 * @param indent             absolute column of items on continuation lines
 * @param horizontalWidth    width available when laid out on one line
 * @param verticalWidth      width available for each line when laid out vertically
 * @param endsWithNewline    whether the text following the list starts on a new line
 */
public record ListFormatting(ListTactic tactic,
                             String separator,
                             SeparatorTactic trailingSeparator,
                             int indent,
                             int horizontalWidth,
                             int verticalWidth,
                             boolean endsWithNewline) {

    /**
     * Comma separated list laid out on one line when it fits, one item per line otherwise,
     * never followed by a trailing comma. This is the layout of generic argument lists.
     */
    public static ListFormatting commaSeparated(int indent, int width) {
        return new ListFormatting(ListTactic.HORIZONTAL_VERTICAL,
                                  ",",
                                  SeparatorTactic.NEVER,
                                  indent,
                                  width,
                                  width,
                                  false);
    }

    public ListFormatting withTactic(ListTactic tactic) {
        return new ListFormatting(tactic, separator, trailingSeparator, indent, horizontalWidth, verticalWidth,
                                  endsWithNewline);
    }

    public ListFormatting withTrailingSeparator(SeparatorTactic trailingSeparator) {
        return new ListFormatting(tactic, separator, trailingSeparator, indent, horizontalWidth, verticalWidth,
                                  endsWithNewline);
    }
}
