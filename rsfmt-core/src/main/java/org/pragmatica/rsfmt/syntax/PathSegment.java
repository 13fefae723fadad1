package org.pragmatica.rsfmt.syntax;

import java.util.Optional;

/**
 * One {@code ::}-delimited component of a path with its optional generic arguments.
 */
public record PathSegment(String identifier, Optional<PathParameters> parameters) {

    public static PathSegment segment(String identifier) {
        return new PathSegment(identifier, Optional.empty());
    }

    public static PathSegment segment(String identifier, PathParameters parameters) {
        return new PathSegment(identifier, Optional.of(parameters));
    }
}
