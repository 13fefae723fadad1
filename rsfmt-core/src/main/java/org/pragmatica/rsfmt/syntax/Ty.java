package org.pragmatica.rsfmt.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Type node. Types are leaves for width-aware rendering and are printed on a single line.
 */
public sealed interface Ty {

    /**
     * The source span covered by this type.
     */
    Span span();

    /**
     * Path type, optionally qualified: {@code Vec<T>} or {@code <T as Trait>::Output}.
     */
    record PathType(Optional<QSelf> qself, Path path, Span span) implements Ty {

        public static PathType pathType(Path path) {
            return new PathType(Optional.empty(), path, path.span());
        }
    }

    /**
     * {@code &'a mut T}.
     */
    record Reference(Optional<Lifetime> lifetime, boolean mutable, Ty ty, Span span) implements Ty {}

    /**
     * {@code *const T} or {@code *mut T}.
     */
    record Pointer(boolean mutable, Ty ty, Span span) implements Ty {}

    record Slice(Ty element, Span span) implements Ty {}

    /**
     * Fixed size array. The length expression is kept as source text.
     */
    record Array(Ty element, String length, Span span) implements Ty {}

    record Tuple(List<Ty> elements, Span span) implements Ty {

        public Tuple {
            elements = List.copyOf(elements);
        }
    }

    record Never(Span span) implements Ty {}

    record Infer(Span span) implements Ty {}

    /**
     * Trait object sum, e.g. {@code Iterator<Item = u8> + Send + 'a}.
     */
    record TraitObject(List<TyParamBound> bounds, Span span) implements Ty {

        public TraitObject {
            bounds = List.copyOf(bounds);
        }
    }

    /**
     * Bare function type, {@code fn(A, B) -> C}.
     */
    record BareFn(List<Ty> inputs, Optional<Ty> output, Span span) implements Ty {

        public BareFn {
            inputs = List.copyOf(inputs);
        }
    }
}
