package org.pragmatica.rsfmt.syntax;

import java.util.List;

/**
 * Possibly global, multi-segment path such as {@code ::std::vec::Vec<T>}.
 */
public record Path(boolean global, List<PathSegment> segments, Span span) implements Rewritable {

    public Path {
        segments = List.copyOf(segments);

        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Path must have at least one segment");
        }
    }

    public static Path path(List<PathSegment> segments, Span span) {
        return new Path(false, segments, span);
    }
}
