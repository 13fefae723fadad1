package org.pragmatica.rsfmt.syntax;

import java.util.List;

/**
 * Lifetime declaration with its (possibly empty) bounds, e.g. {@code 'a: 'b + 'c}.
 */
public record LifetimeDef(Lifetime lifetime, List<Lifetime> bounds, Span span) implements Rewritable {

    public LifetimeDef {
        bounds = List.copyOf(bounds);
    }

    public static LifetimeDef lifetimeDef(Lifetime lifetime, List<Lifetime> bounds) {
        return new LifetimeDef(lifetime, bounds, lifetime.span());
    }
}
