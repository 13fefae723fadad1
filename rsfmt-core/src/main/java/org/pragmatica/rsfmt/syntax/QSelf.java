package org.pragmatica.rsfmt.syntax;

/**
 * Qualified self of a path: the {@code T} in {@code <T as Trait>::Item}.
 *
 * @param ty       the qualifying type
 * @param position number of leading path segments which belong to the trait
 */
public record QSelf(Ty ty, int position) {

    public QSelf {
        if (position < 0) {
            throw new IllegalArgumentException("Negative qualified self position: " + position);
        }
    }
}
