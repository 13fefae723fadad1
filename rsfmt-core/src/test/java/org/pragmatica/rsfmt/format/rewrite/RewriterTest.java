package org.pragmatica.rsfmt.format.rewrite;

import org.junit.jupiter.api.Test;
import org.pragmatica.rsfmt.format.FormatterConfig;
import org.pragmatica.rsfmt.syntax.LifetimeDef;
import org.pragmatica.rsfmt.syntax.Path;
import org.pragmatica.rsfmt.syntax.PolyTraitRef;
import org.pragmatica.rsfmt.syntax.Span;
import org.pragmatica.rsfmt.syntax.SyntaxFixture;
import org.pragmatica.rsfmt.syntax.TyParam;
import org.pragmatica.rsfmt.syntax.WherePredicate.EqPredicate;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.rsfmt.format.rewrite.Shape.shape;
import static org.pragmatica.rsfmt.syntax.PathSegment.segment;
import static org.pragmatica.rsfmt.syntax.SyntaxFixture.fixture;
import static org.pragmatica.rsfmt.syntax.SyntaxFixture.types;

class RewriterTest {

    @Test
    void rewrite_dispatchesPath() {
        var f = fixture("Vec<T>");
        var span = f.find("Vec<T>");
        var path = Path.path(List.of(segment("Vec", types(f.simpleType("T")))), span);

        assertThat(rewriter(f).rewrite(path, shape(100, 0))).contains("Vec<T>");
    }

    @Test
    void rewrite_dispatchesDeclarations() {
        var f = fixture("<'a: 'b, T: Copy>");
        var def = LifetimeDef.lifetimeDef(f.lifetime("'a"), List.of(f.lifetime("'b")));
        var param = new TyParam("T", List.of(f.traitBound("Copy")), Optional.empty(), Span.span(9, 16));
        var rewriter = rewriter(f);

        assertThat(rewriter.rewrite(def, shape(100, 0))).contains("'a: 'b");
        assertThat(rewriter.rewrite(param, shape(100, 0))).contains("T: Copy");
    }

    @Test
    void rewrite_dispatchesBoundsAndTraitRefs() {
        var f = fixture("T: Send");
        var bound = f.traitBound("Send");
        var traitRef = PolyTraitRef.polyTraitRef(bound.traitRef().traitRef());
        var rewriter = rewriter(f);

        assertThat(rewriter.rewrite(bound, shape(100, 3))).contains("Send");
        assertThat(rewriter.rewrite(traitRef, shape(100, 3))).contains("Send");
    }

    @Test
    void rewrite_dispatchesWherePredicate() {
        var f = fixture("where Output = i64");
        var path = f.simplePath("Output");
        var predicate = new EqPredicate(path, f.simpleType("i64"), Span.span(path.span().lo(), f.sourceMap().length()));

        assertThat(rewriter(f).rewrite(predicate, shape(100, 6))).contains("Output = i64");
    }

    @Test
    void rewrite_returnsEmpty_whenNodeDoesNotFit() {
        var f = fixture("Iterator");

        assertThat(rewriter(f).rewrite(f.simplePath("Iterator"), shape(7, 0))).isEmpty();
    }

    private static Rewriter rewriter(SyntaxFixture f) {
        return Rewriter.rewriter(RewriteContext.rewriteContext(f.sourceMap(), FormatterConfig.defaultConfig()));
    }
}
