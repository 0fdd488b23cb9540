package io.exprtree.core.model;

import io.exprtree.core.spi.Transformer;
import java.util.List;
import java.util.Objects;

/**
 * Applies an {@link Operator} to two child expressions.
 *
 * @param left     left operand, evaluated first
 * @param operator the operator
 * @param right    right operand
 */
public record BinaryOperation(Expression left, Operator operator, Expression right) implements Expression {

    public BinaryOperation {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    /**
     * Builds a binary operation from an operator symbol.
     *
     * @throws io.exprtree.core.error.UnknownOperatorException if {@code symbol} is not one of
     *     {@code + - * /}
     */
    public static BinaryOperation of(Expression left, char symbol, Expression right) {
        return new BinaryOperation(left, Operator.fromSymbol(symbol), right);
    }

    @Override
    public double evaluate() {
        double leftValue = left.evaluate();
        double rightValue = right.evaluate();
        return operator.apply(leftValue, rightValue);
    }

    @Override
    public Evaluation evaluateChecked() {
        Evaluation leftResult = left.evaluateChecked();
        Evaluation rightResult = right.evaluateChecked();
        double result = operator.apply(leftResult.value(), rightResult.value());

        if (!leftResult.isOk()) {
            return leftResult.withValue(result);
        }
        if (!rightResult.isOk()) {
            return rightResult.withValue(result);
        }
        if (operator == Operator.DIVIDE && rightResult.value() == 0.0) {
            return Evaluation.domainError(
                    result, "Division by zero: " + leftResult.value() + " / " + rightResult.value());
        }
        if (Double.isNaN(result) && !Double.isNaN(leftResult.value()) && !Double.isNaN(rightResult.value())) {
            return Evaluation.domainError(
                    result, "Operation " + leftResult.value() + " " + operator.symbol() + " " + rightResult.value()
                            + " is undefined");
        }
        return Evaluation.ok(result);
    }

    @Override
    public Expression transform(Transformer transformer) {
        Objects.requireNonNull(transformer, "transformer must not be null");
        return transformer.transformBinaryOperation(this);
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
