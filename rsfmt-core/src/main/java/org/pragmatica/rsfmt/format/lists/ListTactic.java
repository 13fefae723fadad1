package org.pragmatica.rsfmt.format.lists;

/**
 * Layout policy for a list of items.
 */
public enum ListTactic {
    /**
     * One item per row.
     */
    VERTICAL,
    /**
     * All items on one row.
     */
    HORIZONTAL,
    /**
     * Horizontal if everything fits on one line, otherwise vertical.
     */
    HORIZONTAL_VERTICAL,
    /**
     * Pack as many items on each row as fit.
     */
    MIXED
}
