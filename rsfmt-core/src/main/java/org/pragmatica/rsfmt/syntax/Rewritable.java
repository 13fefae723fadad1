package org.pragmatica.rsfmt.syntax;

/**
 * Syntax nodes which can be rewritten within a width budget.
 */
public sealed interface Rewritable permits Path, WherePredicate, LifetimeDef, TyParam, PolyTraitRef, TyParamBound {}
