package org.pragmatica.rsfmt.format.rewrite;

import org.pragmatica.rsfmt.format.lists.ListFormatting;
import org.pragmatica.rsfmt.format.lists.ListItems;
import org.pragmatica.rsfmt.format.printer.PlainPrinter;
import org.pragmatica.rsfmt.syntax.PathParameters.AngleBracketed;
import org.pragmatica.rsfmt.syntax.PathParameters.Parenthesized;
import org.pragmatica.rsfmt.syntax.PathSegment;
import org.pragmatica.rsfmt.syntax.Span;
import org.pragmatica.rsfmt.syntax.Ty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.pragmatica.rsfmt.format.lists.ListFormatter.listFormatter;

/**
 * Rewrites a single path segment: its identifier followed by optional generic arguments.
 *
 * Segments do not carry spans of their own, so the raw source between the cursor and the end of
 * the path is searched for the argument list opener. The cursor is assumed to lie after any previous
 * segment's arguments and at or before the start of this segment; after a segment with arguments it
 * is moved past them so the assumption holds for the next segment.
 */
public class SegmentRewriter {

    private static final Logger log = LoggerFactory.getLogger(SegmentRewriter.class);

    private final RewriteContext context;

    private SegmentRewriter(RewriteContext context) {
        this.context = context;
    }

    public static SegmentRewriter segmentRewriter(RewriteContext context) {
        return new SegmentRewriter(context);
    }

    /**
     * Rewrite the segment.
     *
     * @param segment the segment
     * @param cursor  source position accounted for so far, advanced past the segment's arguments
     * @param pathEnd end offset of the enclosing path
     * @param shape   budget for the segment
     * @return rendered segment or empty if it does not fit
     */
    public Optional<String> rewriteSegment(PathSegment segment, SpanCursor cursor, int pathEnd, Shape shape) {
        var identifier = segment.identifier();
        var afterIdentifier = shape.consume(identifier.length());

        if (afterIdentifier.isEmpty()) {
            log.trace("Identifier '{}' does not fit in {}", identifier, shape);
            return Optional.empty();
        }

        var parameters = segment.parameters();

        if (parameters.isEmpty() || parameters.get().isEmpty()) {
            return Optional.of(identifier);
        }

        Optional<String> params;

        if (parameters.get() instanceof AngleBracketed angle) {
            params = rewriteAngleBracketed(angle, cursor, pathEnd, afterIdentifier.get());
        } else if (parameters.get() instanceof Parenthesized parenthesized) {
            params = rewriteParenthesized(parenthesized, cursor, pathEnd, afterIdentifier.get());
        } else {
            throw new IllegalStateException("Unknown path parameters " + parameters.get());
        }

        return params.map(identifier::concat);
    }

    private Optional<String> rewriteAngleBracketed(AngleBracketed angle, SpanCursor cursor, int pathEnd, Shape shape) {
        var params = segmentParams(angle);
        var sourceMap = context.sourceMap();
        var listStart = listStart(cursor, pathEnd, "<");

        if (listStart.isEmpty()) {
            return Optional.empty();
        }

        var listLo = listStart.get();
        var separator = sourceMap.pathSeparator(cursor.position(), listLo);
        var items = ListItems.itemize(sourceMap,
                                      params,
                                      ",",
                                      ">",
                                      param -> param.span().lo(),
                                      param -> param.span().hi(),
                                      SegmentParam::text,
                                      listLo,
                                      pathEnd);

        // 1 for <
        var extraOffset = 1 + separator.length();
        // 1 for >
        var listShape = shape.reserve(extraOffset + 1);

        if (listShape.isEmpty()) {
            log.trace("Generic arguments do not fit in {}", shape);
            return Optional.empty();
        }

        var formatting = ListFormatting.commaSeparated(shape.offset() + extraOffset, listShape.get().width());

        cursor.advanceTo(params.get(params.size() - 1).span().hi() + 1);

        return Optional.of(separator + "<" + listFormatter(formatting).write(items) + ">");
    }

    private Optional<String> rewriteParenthesized(Parenthesized parenthesized,
                                                  SpanCursor cursor,
                                                  int pathEnd,
                                                  Shape shape) {
        var output = PlainPrinter.outputToString(parenthesized.output());
        var listStart = listStart(cursor, pathEnd, "(");

        if (listStart.isEmpty()) {
            return Optional.empty();
        }

        var listLo = listStart.get();
        var inputs = parenthesized.inputs();
        var items = ListItems.itemize(context.sourceMap(),
                                      inputs,
                                      ",",
                                      ")",
                                      ty -> ty.span().lo(),
                                      ty -> ty.span().hi(),
                                      PlainPrinter::tyToString,
                                      listLo,
                                      pathEnd);

        // 2 for ()
        var budget = shape.reserve(output.length() + 2);

        if (budget.isEmpty()) {
            log.trace("Parenthesized arguments do not fit in {}", shape);
            return Optional.empty();
        }

        // 1 for (
        var formatting = ListFormatting.commaSeparated(shape.offset() + 1, budget.get().width());

        cursor.advanceTo(inputs.isEmpty() ? listLo : inputs.get(inputs.size() - 1).span().hi() + 1);

        return Optional.of("(" + listFormatter(formatting).write(items) + ")" + output);
    }

    private Optional<Integer> listStart(SpanCursor cursor, int pathEnd, String opener) {
        if (cursor.position() >= pathEnd) {
            log.trace("No source left to locate '{}' at {}", opener, cursor.position());
            return Optional.empty();
        }

        var listStart = context.sourceMap()
                               .spanAfter(Span.span(cursor.position(), pathEnd), opener);

        if (listStart.isEmpty()) {
            log.trace("No '{}' in source between {} and {}", opener, cursor.position(), pathEnd);
        }
        return listStart;
    }

    /**
     * Generic arguments in rendering order: lifetimes, then types, then bindings.
     */
    private static List<SegmentParam> segmentParams(AngleBracketed angle) {
        var params = new ArrayList<SegmentParam>();

        angle.lifetimes()
             .forEach(lifetime -> params.add(new SegmentParam(PlainPrinter.lifetimeToString(lifetime),
                                                              lifetime.span())));
        angle.types()
             .forEach(ty -> params.add(typeParam(ty)));
        angle.bindings()
             .forEach(binding -> params.add(new SegmentParam(PlainPrinter.bindingToString(binding),
                                                             binding.span())));
        return params;
    }

    private static SegmentParam typeParam(Ty ty) {
        return new SegmentParam(PlainPrinter.tyToString(ty), ty.span());
    }

    private record SegmentParam(String text, Span span) {}
}
