package org.pragmatica.rsfmt.format.printer;

import org.pragmatica.rsfmt.syntax.Lifetime;
import org.pragmatica.rsfmt.syntax.LifetimeDef;
import org.pragmatica.rsfmt.syntax.Path;
import org.pragmatica.rsfmt.syntax.PathParameters;
import org.pragmatica.rsfmt.syntax.PathParameters.AngleBracketed;
import org.pragmatica.rsfmt.syntax.PathParameters.Parenthesized;
import org.pragmatica.rsfmt.syntax.PathSegment;
import org.pragmatica.rsfmt.syntax.PolyTraitRef;
import org.pragmatica.rsfmt.syntax.QSelf;
import org.pragmatica.rsfmt.syntax.Rewritable;
import org.pragmatica.rsfmt.syntax.TraitBoundModifier;
import org.pragmatica.rsfmt.syntax.Ty;
import org.pragmatica.rsfmt.syntax.TyParam;
import org.pragmatica.rsfmt.syntax.TyParamBound;
import org.pragmatica.rsfmt.syntax.TyParamBound.RegionBound;
import org.pragmatica.rsfmt.syntax.TyParamBound.TraitBound;
import org.pragmatica.rsfmt.syntax.TypeBinding;
import org.pragmatica.rsfmt.syntax.WherePredicate;
import org.pragmatica.rsfmt.syntax.WherePredicate.BoundPredicate;
import org.pragmatica.rsfmt.syntax.WherePredicate.EqPredicate;
import org.pragmatica.rsfmt.syntax.WherePredicate.RegionPredicate;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Single-line printer for syntax elements.
 *
 * No width is taken into account; the output is what the element looks like written on one line.
 * Generic arguments are always printed in type position, i.e. without a leading {@code ::}.
 */
public final class PlainPrinter {

    private PlainPrinter() {}

    /**
     * Print any node which can otherwise be rewritten within a width budget.
     */
    public static String nodeToString(Rewritable node) {
        if (node instanceof Path path) {
            return pathToString(path);
        }
        if (node instanceof WherePredicate predicate) {
            return wherePredicateToString(predicate);
        }
        if (node instanceof LifetimeDef def) {
            return lifetimeDefToString(def);
        }
        if (node instanceof TyParam param) {
            return tyParamToString(param);
        }
        if (node instanceof PolyTraitRef traitRef) {
            return polyTraitRefToString(traitRef);
        }
        if (node instanceof TyParamBound bound) {
            return boundToString(bound);
        }
        throw new IllegalStateException("Unknown node " + node);
    }

    public static String tyToString(Ty ty) {
        if (ty instanceof Ty.PathType pathType) {
            return pathType.qself()
                           .map(qself -> qualifiedPathToString(qself, pathType.path()))
                           .orElseGet(() -> pathToString(pathType.path()));
        }
        if (ty instanceof Ty.Reference reference) {
            return "&"
                   + reference.lifetime().map(lifetime -> lifetimeToString(lifetime) + " ").orElse("")
                   + (reference.mutable() ? "mut " : "")
                   + tyToString(reference.ty());
        }
        if (ty instanceof Ty.Pointer pointer) {
            return (pointer.mutable() ? "*mut " : "*const ") + tyToString(pointer.ty());
        }
        if (ty instanceof Ty.Slice slice) {
            return "[" + tyToString(slice.element()) + "]";
        }
        if (ty instanceof Ty.Array array) {
            return "[" + tyToString(array.element()) + "; " + array.length() + "]";
        }
        if (ty instanceof Ty.Tuple tuple) {
            return tuple.elements().size() == 1
                   ? "(" + tyToString(tuple.elements().get(0)) + ",)"
                   : "(" + join(tuple.elements(), PlainPrinter::tyToString, ", ") + ")";
        }
        if (ty instanceof Ty.Never) {
            return "!";
        }
        if (ty instanceof Ty.Infer) {
            return "_";
        }
        if (ty instanceof Ty.TraitObject traitObject) {
            return boundsToString(traitObject.bounds());
        }
        if (ty instanceof Ty.BareFn bareFn) {
            return "fn(" + join(bareFn.inputs(), PlainPrinter::tyToString, ", ") + ")" + outputToString(bareFn.output());
        }
        throw new IllegalStateException("Unknown type node " + ty);
    }

    public static String pathToString(Path path) {
        return (path.global() ? "::" : "") + segmentsToString(path.segments());
    }

    /**
     * {@code <T as Trait>::rest}. The first {@code qself.position()} segments name the trait.
     */
    public static String qualifiedPathToString(QSelf qself, Path path) {
        var segments = path.segments();
        var position = Math.min(qself.position(), segments.size());
        var result = new StringBuilder("<").append(tyToString(qself.ty()));

        if (position > 0) {
            result.append(" as ")
                  .append(path.global() ? "::" : "")
                  .append(segmentsToString(segments.subList(0, position)));
        }

        result.append(">");

        if (position < segments.size()) {
            result.append("::")
                  .append(segmentsToString(segments.subList(position, segments.size())));
        }
        return result.toString();
    }

    public static String segmentToString(PathSegment segment) {
        return segment.identifier() + segment.parameters()
                                             .map(PlainPrinter::parametersToString)
                                             .orElse("");
    }

    public static String parametersToString(PathParameters parameters) {
        if (parameters instanceof AngleBracketed angle) {
            if (angle.isEmpty()) {
                return "";
            }
            var args = new StringBuilder();
            appendAll(args, angle.lifetimes(), PlainPrinter::lifetimeToString);
            appendAll(args, angle.types(), PlainPrinter::tyToString);
            appendAll(args, angle.bindings(), PlainPrinter::bindingToString);
            return "<" + args + ">";
        }
        if (parameters instanceof Parenthesized parenthesized) {
            return "(" + join(parenthesized.inputs(), PlainPrinter::tyToString, ", ") + ")"
                   + outputToString(parenthesized.output());
        }
        throw new IllegalStateException("Unknown path parameters " + parameters);
    }

    public static String bindingToString(TypeBinding binding) {
        return binding.ident() + " = " + tyToString(binding.ty());
    }

    /**
     * {@code " -> T"} for a present output type, empty string otherwise.
     */
    public static String outputToString(Optional<Ty> output) {
        return output.map(ty -> " -> " + tyToString(ty))
                     .orElse("");
    }

    public static String lifetimeToString(Lifetime lifetime) {
        return lifetime.name();
    }

    public static String lifetimesToString(List<Lifetime> lifetimes, String separator) {
        return join(lifetimes, PlainPrinter::lifetimeToString, separator);
    }

    public static String lifetimeDefToString(LifetimeDef def) {
        if (def.bounds().isEmpty()) {
            return lifetimeToString(def.lifetime());
        }
        return lifetimeToString(def.lifetime()) + ": " + lifetimesToString(def.bounds(), " + ");
    }

    public static String polyTraitRefToString(PolyTraitRef traitRef) {
        if (traitRef.boundLifetimes().isEmpty()) {
            return pathToString(traitRef.traitRef());
        }
        return "for<" + join(traitRef.boundLifetimes(), PlainPrinter::lifetimeDefToString, ", ") + "> "
               + pathToString(traitRef.traitRef());
    }

    public static String boundToString(TyParamBound bound) {
        if (bound instanceof TraitBound traitBound) {
            var prefix = traitBound.modifier() == TraitBoundModifier.MAYBE ? "?" : "";
            return prefix + polyTraitRefToString(traitBound.traitRef());
        }
        if (bound instanceof RegionBound regionBound) {
            return lifetimeToString(regionBound.lifetime());
        }
        throw new IllegalStateException("Unknown bound " + bound);
    }

    public static String boundsToString(List<TyParamBound> bounds) {
        return join(bounds, PlainPrinter::boundToString, " + ");
    }

    public static String tyParamToString(TyParam param) {
        var result = new StringBuilder(param.ident());

        if (!param.bounds().isEmpty()) {
            result.append(": ").append(boundsToString(param.bounds()));
        }
        param.defaultTy()
             .ifPresent(ty -> result.append(" = ").append(tyToString(ty)));
        return result.toString();
    }

    public static String wherePredicateToString(WherePredicate predicate) {
        if (predicate instanceof BoundPredicate bound) {
            var binder = bound.boundLifetimes().isEmpty()
                         ? ""
                         : "for<" + join(bound.boundLifetimes(), PlainPrinter::lifetimeDefToString, ", ") + "> ";
            return binder + tyToString(bound.boundedTy()) + ": " + boundsToString(bound.bounds());
        }
        if (predicate instanceof RegionPredicate region) {
            return lifetimeToString(region.lifetime()) + ": " + lifetimesToString(region.bounds(), " + ");
        }
        if (predicate instanceof EqPredicate eq) {
            return pathToString(eq.path()) + " = " + tyToString(eq.ty());
        }
        throw new IllegalStateException("Unknown where predicate " + predicate);
    }

    private static String segmentsToString(List<PathSegment> segments) {
        return join(segments, PlainPrinter::segmentToString, "::");
    }

    private static <T> void appendAll(StringBuilder builder, List<T> elements, Function<T, String> printer) {
        for (var element : elements) {
            if (builder.length() > 0) {
                builder.append(", ");
            }
            builder.append(printer.apply(element));
        }
    }

    private static <T> String join(List<T> elements, Function<T, String> printer, String separator) {
        return elements.stream()
                       .map(printer)
                       .collect(Collectors.joining(separator));
    }
}
