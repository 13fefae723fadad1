package org.pragmatica.rsfmt.format.rewrite;

import org.pragmatica.rsfmt.syntax.LifetimeDef;
import org.pragmatica.rsfmt.syntax.Path;
import org.pragmatica.rsfmt.syntax.PolyTraitRef;
import org.pragmatica.rsfmt.syntax.Rewritable;
import org.pragmatica.rsfmt.syntax.TyParam;
import org.pragmatica.rsfmt.syntax.TyParamBound;
import org.pragmatica.rsfmt.syntax.WherePredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static org.pragmatica.rsfmt.format.rewrite.BoundRewriter.boundRewriter;
import static org.pragmatica.rsfmt.format.rewrite.PathRewriter.pathRewriter;

/**
 * Entry point for rewriting any {@link Rewritable} node within a {@link Shape}.
 */
public class Rewriter {

    private static final Logger log = LoggerFactory.getLogger(Rewriter.class);

    private final PathRewriter pathRewriter;
    private final BoundRewriter boundRewriter;

    private Rewriter(RewriteContext context) {
        this.pathRewriter = pathRewriter(context);
        this.boundRewriter = boundRewriter(context);
    }

    /**
     * Factory method.
     */
    public static Rewriter rewriter(RewriteContext context) {
        return new Rewriter(context);
    }

    /**
     * Rewrite the node. Returns empty when the node cannot be rendered within the shape.
     */
    public Optional<String> rewrite(Rewritable node, Shape shape) {
        var result = dispatch(node, shape);

        if (result.isEmpty()) {
            log.trace("{} does not fit in {}", node.getClass().getSimpleName(), shape);
        }
        return result;
    }

    private Optional<String> dispatch(Rewritable node, Shape shape) {
        if (node instanceof Path path) {
            return pathRewriter.rewritePath(path, shape);
        }
        if (node instanceof WherePredicate predicate) {
            return boundRewriter.rewriteWherePredicate(predicate, shape);
        }
        if (node instanceof LifetimeDef def) {
            return boundRewriter.rewriteLifetimeDef(def);
        }
        if (node instanceof TyParam param) {
            return boundRewriter.rewriteTyParam(param, shape);
        }
        if (node instanceof PolyTraitRef traitRef) {
            return boundRewriter.rewritePolyTraitRef(traitRef, shape);
        }
        if (node instanceof TyParamBound bound) {
            return boundRewriter.rewriteBound(bound, shape);
        }
        throw new IllegalStateException("Unknown node " + node);
    }
}
