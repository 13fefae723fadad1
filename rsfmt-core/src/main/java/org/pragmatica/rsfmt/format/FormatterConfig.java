package org.pragmatica.rsfmt.format;

/**
 * Configuration for the rsfmt rewriters.
 *
 * @param maxWidth  maximum line width
 * @param tabSpaces number of spaces used for one level of block indentation
 */
public record FormatterConfig(int maxWidth, int tabSpaces) {

    public static final int DEFAULT_MAX_WIDTH = 100;
    public static final int DEFAULT_TAB_SPACES = 4;

    /**
     * Default configuration.
     */
    public static final FormatterConfig DEFAULT = new FormatterConfig(DEFAULT_MAX_WIDTH, DEFAULT_TAB_SPACES);

    public FormatterConfig {
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("maxWidth must be positive, got " + maxWidth);
        }
        if (tabSpaces <= 0) {
            throw new IllegalArgumentException("tabSpaces must be positive, got " + tabSpaces);
        }
    }

    /**
     * Factory method for default config.
     */
    public static FormatterConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Builder-style method to set the maximum line width.
     */
    public FormatterConfig withMaxWidth(int maxWidth) {
        return new FormatterConfig(maxWidth, tabSpaces);
    }

    /**
     * Builder-style method to set block indentation width.
     */
    public FormatterConfig withTabSpaces(int tabSpaces) {
        return new FormatterConfig(maxWidth, tabSpaces);
    }
}
