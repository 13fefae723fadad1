package org.pragmatica.rsfmt.syntax;

/**
 * Associated type binding inside generic arguments, e.g. {@code Item = U}.
 */
public record TypeBinding(String ident, Ty ty, Span span) {}
