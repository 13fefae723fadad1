package org.pragmatica.rsfmt.format.rewrite;

import org.pragmatica.rsfmt.format.printer.PlainPrinter;
import org.pragmatica.rsfmt.syntax.Path;
import org.pragmatica.rsfmt.syntax.PathSegment;
import org.pragmatica.rsfmt.syntax.QSelf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static org.pragmatica.rsfmt.format.rewrite.SegmentRewriter.segmentRewriter;

/**
 * Rewrites paths, optionally qualified: {@code std::vec::Vec<T>}, {@code Foo::<A, B>::new},
 * {@code <T as Iterator>::Item}.
 *
 * Simple segments are never wrapped; only generic argument lists break across lines.
 */
public class PathRewriter {

    private static final Logger log = LoggerFactory.getLogger(PathRewriter.class);

    // ">::".length()
    private static final int QSELF_SUFFIX_WIDTH = 3;

    private final SegmentRewriter segmentRewriter;

    private PathRewriter(RewriteContext context) {
        this.segmentRewriter = segmentRewriter(context);
    }

    public static PathRewriter pathRewriter(RewriteContext context) {
        return new PathRewriter(context);
    }

    public Optional<String> rewritePath(Path path, Shape shape) {
        return rewritePath(Optional.empty(), path, shape);
    }

    /**
     * Rewrite a path.
     *
     * @param qself optional qualified self; its position counts the segments naming the trait
     * @param path  the path
     * @param shape budget for the whole path
     * @return rendered path or empty if it does not fit
     * @throws IllegalArgumentException if the qualified self position exceeds the number of segments
     */
    public Optional<String> rewritePath(Optional<QSelf> qself, Path path, Shape shape) {
        var segments = path.segments();
        var skipCount = qself.map(QSelf::position).orElse(0);

        if (skipCount > segments.size()) {
            throw new IllegalArgumentException("Qualified self position " + skipCount + " exceeds "
                                               + segments.size() + " path segments");
        }

        var cursor = SpanCursor.spanCursor(path.span().lo());
        var pathEnd = path.span().hi();
        var result = new StringBuilder();

        if (qself.isPresent()) {
            var qualified = qself.get();

            result.append('<').append(PlainPrinter.tyToString(qualified.ty()));
            // Arguments of the trait segments come after the qualifying type and the token following it.
            cursor.advanceTo(qualified.ty().span().hi() + 1);

            if (skipCount > 0) {
                result.append(" as ");

                if (path.global()) {
                    result.append("::");
                }

                var traitShape = shape.after(result.toString())
                                      .flatMap(available -> available.reserve(QSELF_SUFFIX_WIDTH));

                if (traitShape.isEmpty()) {
                    log.trace("Qualified self prefix '{}' does not fit in {}", result, shape);
                    return Optional.empty();
                }

                var traitPath = rewriteSegments(segments.subList(0, skipCount), cursor, pathEnd, traitShape.get());

                if (traitPath.isEmpty()) {
                    return Optional.empty();
                }
                result.append(traitPath.get());
            }

            result.append(skipCount < segments.size() ? ">::" : ">");
        } else if (path.global()) {
            result.append("::");
        }

        var restShape = shape.after(result.toString());

        if (restShape.isEmpty()) {
            log.trace("Path prefix '{}' does not fit in {}", result, shape);
            return Optional.empty();
        }

        return rewriteSegments(segments.subList(skipCount, segments.size()), cursor, pathEnd, restShape.get())
                .map(rest -> result + rest);
    }

    /**
     * Segments joined by {@code ::}. Every segment gets the width left on the current line after the
     * text emitted before it, including the {@code ::} preceding it.
     */
    private Optional<String> rewriteSegments(List<PathSegment> segments, SpanCursor cursor, int pathEnd, Shape shape) {
        var buffer = new StringBuilder();

        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                buffer.append("::");
            }

            var segment = segments.get(i);
            var segmentShape = shape.after(buffer.toString());

            if (segmentShape.isEmpty()) {
                log.trace("No room left for segment '{}' in {}", segment.identifier(), shape);
                return Optional.empty();
            }

            var rendered = segmentRewriter.rewriteSegment(segment, cursor, pathEnd, segmentShape.get());

            if (rendered.isEmpty()) {
                return Optional.empty();
            }
            buffer.append(rendered.get());
        }

        return Optional.of(buffer.toString());
    }
}
