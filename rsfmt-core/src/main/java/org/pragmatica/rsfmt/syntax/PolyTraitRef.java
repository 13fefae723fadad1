package org.pragmatica.rsfmt.syntax;

import java.util.List;

/**
 * Trait reference with optional higher-ranked binder, e.g. {@code for<'a> Fn(&'a T)}.
 */
public record PolyTraitRef(List<LifetimeDef> boundLifetimes, Path traitRef, Span span) implements Rewritable {

    public PolyTraitRef {
        boundLifetimes = List.copyOf(boundLifetimes);
    }

    public static PolyTraitRef polyTraitRef(Path traitRef) {
        return new PolyTraitRef(List.of(), traitRef, traitRef.span());
    }
}
