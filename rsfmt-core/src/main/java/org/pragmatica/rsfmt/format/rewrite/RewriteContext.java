package org.pragmatica.rsfmt.format.rewrite;

import org.pragmatica.rsfmt.format.FormatterConfig;
import org.pragmatica.rsfmt.shared.SourceMap;

/**
 * Read-only state shared by all rewriters during one formatting run.
 */
public record RewriteContext(SourceMap sourceMap, FormatterConfig config) {

    public static RewriteContext rewriteContext(SourceMap sourceMap, FormatterConfig config) {
        return new RewriteContext(sourceMap, config);
    }
}
