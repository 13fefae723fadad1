package org.pragmatica.rsfmt.format.rewrite;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.rsfmt.format.rewrite.Shape.shape;

class ShapeTest {

    @Test
    void consume_movesOffsetAndShrinksWidth() {
        assertThat(shape(10, 4).consume(3)).contains(shape(7, 7));
        assertThat(shape(10, 4).consume(10)).contains(shape(0, 14));
    }

    @Test
    void consume_isEmpty_onUnderflow() {
        assertThat(shape(10, 4).consume(11)).isEmpty();
    }

    @Test
    void reserve_keepsOffset() {
        assertThat(shape(10, 4).reserve(3)).contains(shape(7, 4));
        assertThat(shape(2, 4).reserve(3)).isEmpty();
    }

    @Test
    void after_accountsOnlyForLastLineOfMultilineText() {
        // continuation line is indented to absolute column 6, text ends at column 8
        var emitted = "Foo<A,\n      B>";

        assertThat(Shape.extraOffset(emitted, 2)).isEqualTo(6);
        assertThat(shape(20, 2).after(emitted)).contains(shape(14, 8));
        assertThat(shape(20, 2).after("Foo")).contains(shape(17, 5));
    }

    @Test
    void shape_rejectsNegativeValues() {
        assertThatThrownBy(() -> shape(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> shape(0, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
