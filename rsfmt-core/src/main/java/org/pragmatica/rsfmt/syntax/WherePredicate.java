package org.pragmatica.rsfmt.syntax;

import java.util.List;

/**
 * Single predicate of a {@code where} clause.
 */
public sealed interface WherePredicate extends Rewritable {

    Span span();

    /**
     * {@code for<'a> T: Bound + Other}.
     */
    record BoundPredicate(List<LifetimeDef> boundLifetimes, Ty boundedTy, List<TyParamBound> bounds, Span span)
            implements WherePredicate {

        public BoundPredicate {
            boundLifetimes = List.copyOf(boundLifetimes);
            bounds = List.copyOf(bounds);

            if (bounds.isEmpty()) {
                throw new IllegalArgumentException("Bound predicate requires at least one bound");
            }
        }
    }

    /**
     * {@code 'a: 'b + 'c}.
     */
    record RegionPredicate(Lifetime lifetime, List<Lifetime> bounds, Span span) implements WherePredicate {

        public RegionPredicate {
            bounds = List.copyOf(bounds);

            if (bounds.isEmpty()) {
                throw new IllegalArgumentException("Region predicate requires at least one bound");
            }
        }
    }

    /**
     * {@code Path = Type}.
     */
    record EqPredicate(Path path, Ty ty, Span span) implements WherePredicate {}
}
