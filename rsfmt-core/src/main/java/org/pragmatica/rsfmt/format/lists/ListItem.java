package org.pragmatica.rsfmt.format.lists;

import java.util.Optional;

/**
 * Pre-rendered list item together with the comments attached to it in the source.
 */
public record ListItem(Optional<String> preComment, String item, Optional<String> postComment) {

    public static ListItem listItem(String item) {
        return new ListItem(Optional.empty(), item, Optional.empty());
    }

    /**
     * Width of the item including its comments, as if written on one line.
     * Each comment is separated from the item by one space.
     */
    public int totalWidth() {
        return commentWidth(preComment) + item.length() + commentWidth(postComment);
    }

    public boolean isMultiline() {
        return item.contains("\n")
               || preComment.map(comment -> comment.contains("\n")).orElse(false)
               || postComment.map(comment -> comment.contains("\n")).orElse(false);
    }

    public boolean hasLinePreComment() {
        return preComment.map(comment -> comment.startsWith("//")).orElse(false);
    }

    private static int commentWidth(Optional<String> comment) {
        return comment.map(text -> text.length() + 1).orElse(0);
    }
}
