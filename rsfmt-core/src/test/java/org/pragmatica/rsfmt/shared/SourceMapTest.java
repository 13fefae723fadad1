package org.pragmatica.rsfmt.shared;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pragmatica.rsfmt.syntax.Span;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.rsfmt.shared.SourceMap.sourceMap;

class SourceMapTest {

    @Test
    void snippet_returnsTextOfSpan() {
        var sourceMap = sourceMap("let x: Vec<u8> = v;");

        assertThat(sourceMap.snippet(Span.span(7, 14))).isEqualTo("Vec<u8>");
    }

    @Test
    void snippet_rejectsSpanOutsideOfSource() {
        var sourceMap = sourceMap("short");

        assertThatThrownBy(() -> sourceMap.snippet(Span.span(2, 10)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void spanAfter_returnsPositionPastFirstOccurrence() {
        var sourceMap = sourceMap("Foo::<A, B>::bar::<C>");

        assertThat(sourceMap.spanAfter(Span.span(0, 21), "<")).contains(6);
        assertThat(sourceMap.spanAfter(Span.span(11, 21), "<")).contains(19);
    }

    @Test
    void spanAfter_isEmpty_whenNeedleIsMissing() {
        var sourceMap = sourceMap("Foo::bar");

        assertThat(sourceMap.spanAfter(Span.span(0, 8), "<")).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Foo::<A>    | ::",
            "Foo:: <A>   | ::",
            "Foo ::\t<A> | ::",
            "Foo<A>      | ''",
            "Foo <A>     | ''",
            "Vec<<T as Trait>::X> | ''"
    })
    void pathSeparator_recoversSeparatorWrittenBeforeOpener(String source, String expected) {
        var sourceMap = sourceMap(source);
        var opener = source.indexOf('<') + 1;

        assertThat(sourceMap.pathSeparator(0, opener)).isEqualTo(expected);
    }

    @Test
    void pathSeparator_isEmpty_forBlankText() {
        var sourceMap = sourceMap("  <A>");

        assertThat(sourceMap.pathSeparator(0, 3)).isEmpty();
    }

    @Test
    void pathSeparator_isMisledByColonInCommentBeforeOpener() {
        // Known limitation: comments are not skipped.
        var sourceMap = sourceMap("Foo // note:\n<A>");
        var opener = sourceMap.source().indexOf('<') + 1;

        assertThat(sourceMap.pathSeparator(0, opener)).isEqualTo("::");
    }

    @Test
    void pathSeparator_isMisledByOpenerInCommentBeforeSeparator() {
        // Known limitation: the first '<' is taken as the opener even inside a comment.
        var sourceMap = sourceMap("Foo /* <- */ ::<A>");
        var opener = sourceMap.spanAfter(Span.span(0, sourceMap.length()), "<");

        assertThat(opener).contains(8);
        assertThat(sourceMap.pathSeparator(0, opener.get())).isEmpty();
    }
}
