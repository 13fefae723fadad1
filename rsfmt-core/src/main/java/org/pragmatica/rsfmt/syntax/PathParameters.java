package org.pragmatica.rsfmt.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Generic arguments of a path segment.
 */
public sealed interface PathParameters {

    /**
     * Whether the parameter list carries no arguments at all.
     */
    boolean isEmpty();

    /**
     * Angle-bracketed arguments: {@code <'a, T, Item = U>}.
     * Lifetimes always precede types, types always precede bindings.
     */
    record AngleBracketed(List<Lifetime> lifetimes, List<Ty> types, List<TypeBinding> bindings)
            implements PathParameters {

        public AngleBracketed {
            lifetimes = List.copyOf(lifetimes);
            types = List.copyOf(types);
            bindings = List.copyOf(bindings);
        }

        @Override
        public boolean isEmpty() {
            return lifetimes.isEmpty() && types.isEmpty() && bindings.isEmpty();
        }
    }

    /**
     * Function trait sugar: {@code (A, B) -> C}.
     */
    record Parenthesized(List<Ty> inputs, Optional<Ty> output, Span span) implements PathParameters {

        public Parenthesized {
            inputs = List.copyOf(inputs);
        }

        @Override
        public boolean isEmpty() {
            return false;
        }
    }
}
