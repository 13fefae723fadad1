package org.pragmatica.rsfmt.format.lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Joins pre-rendered list items into text according to a {@link ListFormatting}.
 *
 * Vertical layout aligns continuation items to the configured indent column, which callers
 * set to the column just after the list opener:
 *
 * <pre>
 * HashMap&lt;String,
 *         Vec&lt;u8&gt;&gt;
 * </pre>
 */
public class ListFormatter {

    private static final Logger log = LoggerFactory.getLogger(ListFormatter.class);

    private final ListFormatting formatting;

    private ListFormatter(ListFormatting formatting) {
        this.formatting = formatting;
    }

    /**
     * Factory method.
     */
    public static ListFormatter listFormatter(ListFormatting formatting) {
        return new ListFormatter(formatting);
    }

    /**
     * Write the items. An empty list produces an empty string.
     */
    public String write(List<ListItem> items) {
        if (items.isEmpty()) {
            return "";
        }

        var separator = formatting.separator();
        var separatorCount = formatting.trailingSeparator() == SeparatorTactic.ALWAYS
                             ? items.size()
                             : items.size() - 1;
        // Each separator is followed by a space in horizontal mode.
        var totalSeparatorWidth = (separator.length() + 1) * separatorCount;
        var totalWidth = items.stream()
                              .mapToInt(ListItem::totalWidth)
                              .sum();
        var fitsSingle = totalWidth + totalSeparatorWidth <= formatting.horizontalWidth();

        var tactic = chooseTactic(items, fitsSingle);

        log.trace("List of {} items, width {} + {} of {}: {}",
                  items.size(), totalWidth, totalSeparatorWidth, formatting.horizontalWidth(), tactic);

        var trailingSeparator = formatting.trailingSeparator().needsTrailingSeparator(tactic);
        var indent = " ".repeat(formatting.indent());
        var result = new StringBuilder();
        int lineLength = 0;

        for (int i = 0; i < items.size(); i++) {
            var item = items.get(i);
            var first = i == 0;
            var last = i == items.size() - 1;
            var separate = !last || trailingSeparator;
            var itemSeparatorWidth = separate ? separator.length() : 0;

            switch (tactic) {
                case HORIZONTAL -> {
                    if (!first) {
                        result.append(' ');
                    }
                }
                case VERTICAL -> {
                    if (!first) {
                        result.append('\n').append(indent);
                    }
                }
                case MIXED -> {
                    var width = item.totalWidth() + itemSeparatorWidth;

                    if (lineLength > 0 && lineLength + width > formatting.verticalWidth()) {
                        result.append('\n').append(indent);
                        lineLength = 0;
                    }
                    if (lineLength > 0) {
                        result.append(' ');
                        lineLength++;
                    }
                    lineLength += width;
                }
                default -> throw new IllegalStateException("Unresolved list tactic " + tactic);
            }

            item.preComment().ifPresent(comment -> {
                result.append(comment);

                if (tactic == ListTactic.VERTICAL) {
                    result.append('\n').append(indent);
                } else {
                    result.append(' ');
                }
            });

            result.append(item.item());

            if (tactic != ListTactic.VERTICAL) {
                item.postComment()
                    .ifPresent(comment -> result.append(' ').append(Comments.toBlockComment(comment)));
            }

            if (separate) {
                result.append(separator);
            }

            if (tactic == ListTactic.VERTICAL) {
                item.postComment()
                    .ifPresent(comment -> result.append(' ')
                                                .append(verticalPostComment(comment, last)));
            }
        }

        return result.toString();
    }

    private ListTactic chooseTactic(List<ListItem> items, boolean fitsSingle) {
        var tactic = formatting.tactic();

        if (tactic == ListTactic.HORIZONTAL_VERTICAL) {
            var anyMultiline = items.stream()
                                    .anyMatch(ListItem::isMultiline);
            tactic = fitsSingle && !anyMultiline ? ListTactic.HORIZONTAL : ListTactic.VERTICAL;
        }

        if (tactic == ListTactic.MIXED && fitsSingle) {
            tactic = ListTactic.HORIZONTAL;
        }

        // Line comments cannot be followed by anything on the same line.
        if (items.stream()
                 .anyMatch(ListItem::hasLinePreComment)) {
            tactic = ListTactic.VERTICAL;
        }

        return tactic;
    }

    /**
     * A line comment on the last item would swallow the list terminator unless the list ends a line.
     */
    private String verticalPostComment(String comment, boolean last) {
        return last && !formatting.endsWithNewline() ? Comments.toBlockComment(comment) : comment;
    }
}
