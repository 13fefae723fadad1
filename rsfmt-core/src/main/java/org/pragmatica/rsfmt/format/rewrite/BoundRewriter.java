package org.pragmatica.rsfmt.format.rewrite;

import org.pragmatica.rsfmt.format.printer.PlainPrinter;
import org.pragmatica.rsfmt.syntax.LifetimeDef;
import org.pragmatica.rsfmt.syntax.PolyTraitRef;
import org.pragmatica.rsfmt.syntax.TraitBoundModifier;
import org.pragmatica.rsfmt.syntax.TyParam;
import org.pragmatica.rsfmt.syntax.TyParamBound;
import org.pragmatica.rsfmt.syntax.TyParamBound.RegionBound;
import org.pragmatica.rsfmt.syntax.TyParamBound.TraitBound;
import org.pragmatica.rsfmt.syntax.WherePredicate;
import org.pragmatica.rsfmt.syntax.WherePredicate.BoundPredicate;
import org.pragmatica.rsfmt.syntax.WherePredicate.EqPredicate;
import org.pragmatica.rsfmt.syntax.WherePredicate.RegionPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.pragmatica.rsfmt.format.rewrite.PathRewriter.pathRewriter;

/**
 * Rewrites where-predicates, bounds, higher-ranked trait references, lifetime definitions and
 * type parameters.
 *
 * Lifetimes, bounded types and defaults are printed on one line; only the trait paths inside bounds
 * are rendered within the remaining width. A bound which does not fit fails the whole element.
 */
public class BoundRewriter {

    private static final Logger log = LoggerFactory.getLogger(BoundRewriter.class);

    private final PathRewriter pathRewriter;

    private BoundRewriter(RewriteContext context) {
        this.pathRewriter = pathRewriter(context);
    }

    public static BoundRewriter boundRewriter(RewriteContext context) {
        return new BoundRewriter(context);
    }

    public Optional<String> rewriteWherePredicate(WherePredicate predicate, Shape shape) {
        if (predicate instanceof BoundPredicate bound) {
            return rewriteBoundPredicate(bound, shape);
        }
        if (predicate instanceof RegionPredicate region) {
            return Optional.of(PlainPrinter.lifetimeToString(region.lifetime()) + ": "
                               + PlainPrinter.lifetimesToString(region.bounds(), " + "));
        }
        if (predicate instanceof EqPredicate eq) {
            return rewriteEqPredicate(eq, shape);
        }
        throw new IllegalStateException("Unknown where predicate " + predicate);
    }

    private Optional<String> rewriteBoundPredicate(BoundPredicate predicate, Shape shape) {
        var typeStr = PlainPrinter.tyToString(predicate.boundedTy());
        String prefix;

        if (predicate.boundLifetimes().isEmpty()) {
            prefix = typeStr + ": ";
        } else {
            prefix = "for<" + lifetimeDefs(predicate.boundLifetimes()) + "> " + typeStr + ": ";
        }

        // binders + type + 8 ("for<> : ") or type + 2 (": ")
        var usedWidth = prefix.length();

        return shape.consume(usedWidth)
                    .flatMap(boundsShape -> rewriteBounds(predicate.bounds(), boundsShape))
                    .map(prefix::concat);
    }

    private Optional<String> rewriteEqPredicate(EqPredicate predicate, Shape shape) {
        var typeStr = PlainPrinter.tyToString(predicate.ty());
        // 3 = " = ".length()
        var usedWidth = 3 + typeStr.length();
        var pathShape = shape.consume(usedWidth);

        if (pathShape.isEmpty()) {
            log.trace("Right hand side '{}' does not fit in {}", typeStr, shape);
            return Optional.empty();
        }

        return pathRewriter.rewritePath(predicate.path(), pathShape.get())
                           .map(path -> path + " = " + typeStr);
    }

    /**
     * Lifetime definitions are assumed to always fit on one line.
     */
    public Optional<String> rewriteLifetimeDef(LifetimeDef def) {
        return Optional.of(PlainPrinter.lifetimeDefToString(def));
    }

    public Optional<String> rewriteBound(TyParamBound bound, Shape shape) {
        if (bound instanceof TraitBound traitBound) {
            if (traitBound.modifier() == TraitBoundModifier.MAYBE) {
                // 1 for ?
                return shape.consume(1)
                            .flatMap(rest -> rewritePolyTraitRef(traitBound.traitRef(), rest))
                            .map(path -> "?" + path);
            }
            return rewritePolyTraitRef(traitBound.traitRef(), shape);
        }
        if (bound instanceof RegionBound regionBound) {
            return Optional.of(PlainPrinter.lifetimeToString(regionBound.lifetime()));
        }
        throw new IllegalStateException("Unknown bound " + bound);
    }

    public Optional<String> rewritePolyTraitRef(PolyTraitRef traitRef, Shape shape) {
        if (traitRef.boundLifetimes().isEmpty()) {
            return pathRewriter.rewritePath(traitRef.traitRef(), shape);
        }

        var lifetimes = lifetimeDefs(traitRef.boundLifetimes());
        // 6 = "for<> ".length()
        var extraOffset = lifetimes.length() + 6;

        return shape.consume(extraOffset)
                    .flatMap(pathShape -> pathRewriter.rewritePath(traitRef.traitRef(), pathShape))
                    .map(path -> "for<" + lifetimes + "> " + path);
    }

    /**
     * {@code T: Bound + Other = Default}.
     * <p>
     * The bounds get the full shape of the parameter, the width taken by {@code T: } is not subtracted.
     */
    public Optional<String> rewriteTyParam(TyParam param, Shape shape) {
        var result = new StringBuilder(param.ident());

        if (!param.bounds().isEmpty()) {
            var bounds = rewriteBounds(param.bounds(), shape);

            if (bounds.isEmpty()) {
                return Optional.empty();
            }
            result.append(": ").append(bounds.get());
        }

        param.defaultTy()
             .ifPresent(ty -> result.append(" = ").append(PlainPrinter.tyToString(ty)));

        return Optional.of(result.toString());
    }

    /**
     * Every bound is rendered with the same shape and joined by {@code " + "}.
     */
    private Optional<String> rewriteBounds(List<TyParamBound> bounds, Shape shape) {
        var rendered = new ArrayList<String>(bounds.size());

        for (var bound : bounds) {
            var text = rewriteBound(bound, shape);

            if (text.isEmpty()) {
                log.trace("Bound '{}' does not fit in {}", PlainPrinter.boundToString(bound), shape);
                return Optional.empty();
            }
            rendered.add(text.get());
        }

        return Optional.of(String.join(" + ", rendered));
    }

    private String lifetimeDefs(List<LifetimeDef> defs) {
        return defs.stream()
                   .map(PlainPrinter::lifetimeDefToString)
                   .collect(Collectors.joining(", "));
    }
}
