package org.pragmatica.rsfmt.syntax;

public enum TraitBoundModifier {
    NONE,
    /**
     * Relaxed bound, written {@code ?Trait}.
     */
    MAYBE
}
