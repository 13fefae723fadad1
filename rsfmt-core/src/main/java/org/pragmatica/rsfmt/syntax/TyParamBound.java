package org.pragmatica.rsfmt.syntax;

/**
 * Single bound of a type parameter or where-predicate.
 */
public sealed interface TyParamBound extends Rewritable {

    record TraitBound(PolyTraitRef traitRef, TraitBoundModifier modifier) implements TyParamBound {

        public static TraitBound traitBound(PolyTraitRef traitRef) {
            return new TraitBound(traitRef, TraitBoundModifier.NONE);
        }

        public static TraitBound maybeBound(PolyTraitRef traitRef) {
            return new TraitBound(traitRef, TraitBoundModifier.MAYBE);
        }
    }

    record RegionBound(Lifetime lifetime) implements TyParamBound {}
}
