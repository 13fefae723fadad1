package org.pragmatica.rsfmt.format.lists;

/**
 * Policy for a separator after the last item.
 */
public enum SeparatorTactic {
    ALWAYS,
    NEVER,
    VERTICAL;

    boolean needsTrailingSeparator(ListTactic tactic) {
        return switch (this) {
            case ALWAYS -> true;
            case VERTICAL -> tactic == ListTactic.VERTICAL;
            case NEVER -> false;
        };
    }
}
