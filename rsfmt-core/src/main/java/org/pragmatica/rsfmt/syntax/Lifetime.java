package org.pragmatica.rsfmt.syntax;

/**
 * Lifetime reference such as {@code 'a} or {@code 'static}. The name includes the leading quote.
 */
public record Lifetime(String name, Span span) {

    public static Lifetime lifetime(String name, Span span) {
        return new Lifetime(name, span);
    }
}
