package io.exprtree.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for the leaf variants {@link Number} and {@link Variable}. */
class LeafNodeTest {

    @Nested
    @DisplayName("Number")
    class NumberNode {

        @ParameterizedTest
        @ValueSource(doubles = {0.0, -0.0, 1.5, -273.15, Double.MAX_VALUE, Double.MIN_VALUE})
        void evaluatesToItsValueExactly(double value) {
            Number number = new Number(value);

            assertThat(Double.compare(number.evaluate(), value)).isZero();
            assertThat(number.evaluateChecked()).isEqualTo(Evaluation.ok(value));
        }

        @Test
        void nonFiniteValuesAreAccepted() {
            assertThat(new Number(Double.POSITIVE_INFINITY).evaluate()).isInfinite();
            assertThat(new Number(Double.NaN).evaluate()).isNaN();
            assertThat(new Number(Double.NaN).evaluateChecked().isOk()).isTrue();
        }

        @Test
        void hasNoChildren() {
            assertThat(new Number(1).children()).isEmpty();
        }

        @Test
        void rendersAsPlainValue() {
            assertThat(new Number(32.0)).hasToString("32.0");
        }
    }

    @Nested
    @DisplayName("Variable")
    class VariableNode {

        @Test
        void evaluatesToBoundValueRegardlessOfName() {
            assertThat(new Variable("var", 10.0).evaluate()).isEqualTo(10.0);
            assertThat(new Variable("other_name", 10.0).evaluate()).isEqualTo(10.0);
            assertThat(new Variable("_x1", -3.25).evaluateChecked()).isEqualTo(Evaluation.ok(-3.25));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "1abc", "a-b", "a b", "π"})
        void rejectsNonIdentifierNames(String name) {
            assertThatThrownBy(() -> new Variable(name, 1.0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("identifier");
        }

        @Test
        void rejectsNullName() {
            assertThatThrownBy(() -> new Variable(null, 1.0)).isInstanceOf(NullPointerException.class);
        }

        @Test
        void equalityCoversNameAndValue() {
            assertThat(new Variable("a", 1.0)).isEqualTo(new Variable("a", 1.0));
            assertThat(new Variable("a", 1.0)).isNotEqualTo(new Variable("b", 1.0));
            assertThat(new Variable("a", 1.0)).isNotEqualTo(new Variable("a", 2.0));
        }

        @Test
        void rendersAsName() {
            assertThat(new Variable("var", 10.0)).hasToString("var");
        }
    }
}
