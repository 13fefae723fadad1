package org.pragmatica.rsfmt.format;

import org.pragmatica.rsfmt.format.printer.PlainPrinter;
import org.pragmatica.rsfmt.format.rewrite.RewriteContext;
import org.pragmatica.rsfmt.format.rewrite.Rewriter;
import org.pragmatica.rsfmt.format.rewrite.Shape;
import org.pragmatica.rsfmt.shared.SourceMap;
import org.pragmatica.rsfmt.syntax.Rewritable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Formatter for paths, bounds and generic declarations.
 *
 * Rendering strategy for an element starting at some column:
 * - render it where it starts, within {@code maxWidth}
 * - otherwise, start a new line at the continuation indent and render it there
 * - otherwise, print it on one line and accept the overflow
 */
public class TypeFormatter {

    private static final Logger log = LoggerFactory.getLogger(TypeFormatter.class);

    private final FormatterConfig config;

    private TypeFormatter(FormatterConfig config) {
        this.config = config;
    }

    /**
     * Factory method for creating a formatter with default config.
     */
    public static TypeFormatter typeFormatter() {
        return new TypeFormatter(FormatterConfig.defaultConfig());
    }

    /**
     * Factory method for creating a formatter with custom config.
     */
    public static TypeFormatter typeFormatter(FormatterConfig config) {
        return new TypeFormatter(config);
    }

    public FormatterConfig config() {
        return config;
    }

    /**
     * Render the node starting at column {@code offset}. Empty when it does not fit into {@code maxWidth}.
     */
    public Optional<String> rewrite(SourceMap sourceMap, Rewritable node, int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Negative offset " + offset);
        }
        if (offset > config.maxWidth()) {
            return Optional.empty();
        }

        return Rewriter.rewriter(RewriteContext.rewriteContext(sourceMap, config))
                       .rewrite(node, Shape.shape(config.maxWidth() - offset, offset));
    }

    /**
     * Render the node which starts at column {@code offset} of a line indented by {@code blockIndent}.
     * <p>
     * When the node does not fit where it starts, the returned text begins with a line break followed by
     * the continuation indent ({@code blockIndent + tabSpaces}). When it does not fit there either, the
     * single-line rendition is returned even though it exceeds the maximum width.
     */
    public String format(SourceMap sourceMap, Rewritable node, int offset, int blockIndent) {
        var inPlace = rewrite(sourceMap, node, offset);

        if (inPlace.isPresent()) {
            return inPlace.get();
        }

        var continuationIndent = blockIndent + config.tabSpaces();

        if (continuationIndent < offset) {
            log.debug("{} does not fit at column {}, retrying on a new line at column {}",
                      node.getClass().getSimpleName(), offset, continuationIndent);

            var onNewLine = rewrite(sourceMap, node, continuationIndent);

            if (onNewLine.isPresent()) {
                return "\n" + " ".repeat(continuationIndent) + onNewLine.get();
            }
        }

        var plain = PlainPrinter.nodeToString(node);

        log.debug("{} does not fit into {} columns, falling back to single line '{}'",
                  node.getClass().getSimpleName(), config.maxWidth(), plain);
        return plain;
    }
}
