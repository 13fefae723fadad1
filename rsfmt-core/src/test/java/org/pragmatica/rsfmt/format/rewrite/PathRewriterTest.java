package org.pragmatica.rsfmt.format.rewrite;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.rsfmt.format.FormatterConfig;
import org.pragmatica.rsfmt.syntax.Path;
import org.pragmatica.rsfmt.syntax.QSelf;
import org.pragmatica.rsfmt.syntax.SyntaxFixture;
import org.pragmatica.rsfmt.syntax.Ty;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.rsfmt.format.rewrite.Shape.shape;
import static org.pragmatica.rsfmt.syntax.PathSegment.segment;
import static org.pragmatica.rsfmt.syntax.SyntaxFixture.angle;
import static org.pragmatica.rsfmt.syntax.SyntaxFixture.fixture;
import static org.pragmatica.rsfmt.syntax.SyntaxFixture.types;

class PathRewriterTest {

    @Test
    void rewritePath_keepsTurbofish_inExpressionPosition() {
        var f = fixture("let v = Foo::<A, B>::new();");
        var span = f.find("Foo::<A, B>::new");
        var path = Path.path(List.of(segment("Foo", types(f.simpleType("A"), f.simpleType("B"))),
                                     segment("new")),
                             span);

        assertThat(rewriter(f).rewritePath(path, shape(100, 8))).contains("Foo::<A, B>::new");
    }

    @Test
    void rewritePath_omitsSeparator_inItemPosition() {
        var f = fixture("struct S { v: Foo<A, B> }");
        var span = f.find("Foo<A, B>");
        var path = Path.path(List.of(segment("Foo", types(f.simpleType("A"), f.simpleType("B")))), span);

        assertThat(rewriter(f).rewritePath(path, shape(100, 14))).contains("Foo<A, B>");
    }

    @Test
    void rewritePath_ordersLifetimesTypesAndBindings() {
        var f = fixture("x: Foo<'a, T, Item = U>");
        var span = f.find("Foo<'a, T, Item = U>");
        var args = angle(List.of(f.lifetime("'a")), List.of(f.simpleType("T")), List.of(f.binding("Item", "U")));
        var path = Path.path(List.of(segment("Foo", args)), span);

        assertThat(rewriter(f).rewritePath(path, shape(100, 3))).contains("Foo<'a, T, Item = U>");
    }

    @Test
    void rewritePath_joinsArguments_whenCommaStartsNextLine() {
        var f = fixture("type X = Foo<A\n    , B>;");
        var span = f.find("Foo<A\n    , B>");
        var path = Path.path(List.of(segment("Foo", types(f.simpleType("A"), f.simpleType("B")))), span);

        assertThat(rewriter(f).rewritePath(path, shape(100, 9))).contains("Foo<A, B>");
    }

    @Test
    void rewritePath_fails_whenIdentifierDoesNotFit() {
        var f = fixture("Foo");
        var path = f.simplePath("Foo");

        assertThat(rewriter(f).rewritePath(path, shape(2, 0))).isEmpty();
        assertThat(rewriter(f).rewritePath(path, shape(3, 0))).contains("Foo");
    }

    @Test
    void rewritePath_breaksArgumentsOneColumnShortOfFitting() {
        var f = fixture("type X = Foo<A, B, C>;");
        var span = f.find("Foo<A, B, C>");
        var path = Path.path(List.of(segment("Foo", types(f.simpleType("A"),
                                                          f.simpleType("B"),
                                                          f.simpleType("C")))),
                             span);
        var rewriter = rewriter(f);

        assertThat(rewriter.rewritePath(path, shape(12, 9))).contains("Foo<A, B, C>");
        // items aligned to the column right after "<"
        assertThat(rewriter.rewritePath(path, shape(11, 9)))
                .contains("Foo<A,\n" + " ".repeat(13) + "B,\n" + " ".repeat(13) + "C>");
    }

    @Test
    void rewritePath_accountsForGlobalPrefixAndSeparators() {
        var f = fixture("::std::mem::swap");
        var path = new Path(true, List.of(segment("std"), segment("mem"), segment("swap")), f.find("::std::mem::swap"));

        assertThat(rewriter(f).rewritePath(path, shape(16, 0))).contains("::std::mem::swap");
        assertThat(rewriter(f).rewritePath(path, shape(15, 0))).isEmpty();
    }

    @Test
    void rewritePath_rendersQualifiedSelfPrefixSeparately() {
        var f = fixture("let x = <Foo as Bar>::baz;");
        var span = f.find("<Foo as Bar>::baz");
        var qself = new QSelf(f.simpleType("Foo"), 1);
        var path = Path.path(List.of(segment("Bar"), segment("baz")), span);
        var rewriter = rewriter(f);

        assertThat(rewriter.rewritePath(Optional.of(qself), path, shape(17, 8))).contains("<Foo as Bar>::baz");
        assertThat(rewriter.rewritePath(Optional.of(qself), path, shape(16, 8))).isEmpty();
        // "<Foo as " leaves no room for ">::"
        assertThat(rewriter.rewritePath(Optional.of(qself), path, shape(9, 8))).isEmpty();
    }

    @Test
    void rewritePath_locatesTraitArgumentsAfterQualifyingType() {
        var f = fixture("let x = <Vec<T> as Into<U>>::into;");
        var span = f.find("<Vec<T> as Into<U>>::into");
        var vecSpan = f.find("Vec<T>");
        var vec = new Ty.PathType(Optional.empty(),
                                  Path.path(List.of(segment("Vec", types(f.simpleType("T")))), vecSpan),
                                  vecSpan);
        var path = Path.path(List.of(segment("Into", types(f.simpleType("U"))), segment("into")), span);

        assertThat(rewriter(f).rewritePath(Optional.of(new QSelf(vec, 1)), path, shape(100, 8)))
                .contains("<Vec<T> as Into<U>>::into");
    }

    @Test
    void rewritePath_rendersBareQualifiedSelf() {
        var f = fixture("let x = <T>::default();");
        var span = f.find("<T>::default");
        var qself = new QSelf(f.simpleType("T"), 0);
        var path = Path.path(List.of(segment("default")), span);

        assertThat(rewriter(f).rewritePath(Optional.of(qself), path, shape(100, 8))).contains("<T>::default");
    }

    @Test
    void rewritePath_rejectsQualifiedSelfPositionBeyondSegments() {
        var f = fixture("<T as Foo>::bar");
        var span = f.find("<T as Foo>::bar");
        var qself = new QSelf(f.simpleType("T"), 3);
        var path = Path.path(List.of(segment("Foo"), segment("bar")), span);

        assertThatThrownBy(() -> rewriter(f).rewritePath(Optional.of(qself), path, shape(100, 0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {16, 17, 18, 20, 22, 23, 24, 25, 30})
    void rewritePath_keepsEveryLineWithinWidth(int width) {
        var offset = 7;
        var f = fixture("let m: HashMap<String, Vec<u8>> = m;");
        var span = f.find("HashMap<String, Vec<u8>>");
        var string = f.simpleType("String");
        var vecSpan = f.find("Vec<u8>");
        var vec = Ty.PathType.pathType(Path.path(List.of(segment("Vec", types(f.simpleType("u8")))), vecSpan));
        var path = Path.path(List.of(segment("HashMap", types(string, vec))), span);

        var rendered = rewriter(f).rewritePath(path, shape(width, offset));

        assertThat(rendered).isPresent();

        var lines = rendered.get().split("\n");
        assertThat(lines[0].length()).isLessThanOrEqualTo(width);
        for (int i = 1; i < lines.length; i++) {
            // continuation lines carry their absolute indentation
            assertThat(lines[i].length() - offset).isLessThanOrEqualTo(width);
        }
    }

    private static PathRewriter rewriter(SyntaxFixture f) {
        return PathRewriter.pathRewriter(RewriteContext.rewriteContext(f.sourceMap(), FormatterConfig.defaultConfig()));
    }
}
