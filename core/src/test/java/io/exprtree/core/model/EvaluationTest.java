package io.exprtree.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.exprtree.core.error.ArithmeticDomainException;
import io.exprtree.core.error.UnknownFunctionException;
import io.exprtree.core.testkit.TestTrees;
import org.junit.jupiter.api.Test;

/** Tests for the {@link Evaluation} result type. */
class EvaluationTest {

    @Test
    void okReturnsValueFromOrElseThrow() {
        Evaluation result = Evaluation.ok(40.0);

        assertThat(result.isOk()).isTrue();
        assertThat(result.detail()).isNull();
        assertThat(result.orElseThrow()).isEqualTo(40.0);
    }

    @Test
    void unknownFunctionThrowsUnknownFunctionException() {
        Evaluation result = Evaluation.unknownFunction("bogus");

        assertThat(result.value()).isEqualTo(FunctionCall.UNKNOWN_FUNCTION_VALUE);
        assertThatThrownBy(result::orElseThrow)
                .isInstanceOf(UnknownFunctionException.class)
                .hasMessageContaining("bogus")
                .satisfies(e -> assertThat(((UnknownFunctionException) e).functionName())
                        .isEqualTo("bogus"));
    }

    @Test
    void domainErrorThrowsArithmeticDomainExceptionCarryingValue() {
        Evaluation result = Evaluation.domainError(Double.NEGATIVE_INFINITY, "Division by zero: -1.0 / 0.0");

        assertThatThrownBy(result::orElseThrow)
                .isInstanceOf(ArithmeticDomainException.class)
                .hasMessage("Division by zero: -1.0 / 0.0")
                .satisfies(e -> assertThat(((ArithmeticDomainException) e).value())
                        .isEqualTo(Double.NEGATIVE_INFINITY));
    }

    @Test
    void equalityTreatsNaNAsEqual() {
        assertThat(Evaluation.ok(Double.NaN)).isEqualTo(Evaluation.ok(Double.NaN));
        assertThat(Evaluation.ok(Double.NaN).hashCode()).isEqualTo(Evaluation.ok(Double.NaN).hashCode());
        assertThat(Evaluation.ok(1.0)).isNotEqualTo(Evaluation.unknownFunction("x"));
    }

    @Test
    void checkedValueAlwaysMatchesPlainEvaluate() {
        Expression[] trees = {
            TestTrees.reference(),
            TestTrees.mixed(),
            new FunctionCall("sqrt", new BinaryOperation(new Number(1), Operator.SUBTRACT, new Number(5))),
            new BinaryOperation(new FunctionCall("nope", new Number(3)), Operator.DIVIDE, new Number(0)),
        };

        for (Expression tree : trees) {
            assertThat(Double.compare(tree.evaluateChecked().value(), tree.evaluate()))
                    .as("value of %s", tree)
                    .isZero();
        }
    }

    @Test
    void toStringShowsStatus() {
        assertThat(Evaluation.ok(2.0)).hasToString("Evaluation[OK, value=2.0]");
        assertThat(Evaluation.unknownFunction("f").toString()).contains("UNKNOWN_FUNCTION", "f");
    }
}
