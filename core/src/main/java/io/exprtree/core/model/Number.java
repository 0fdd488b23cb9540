package io.exprtree.core.model;

import io.exprtree.core.spi.Transformer;
import java.util.List;
import java.util.Objects;

/**
 * A numeric literal.
 *
 * @param value the literal value, any double
 */
public record Number(double value) implements Expression {

    @Override
    public double evaluate() {
        return value;
    }

    @Override
    public Evaluation evaluateChecked() {
        return Evaluation.ok(value);
    }

    @Override
    public Expression transform(Transformer transformer) {
        Objects.requireNonNull(transformer, "transformer must not be null");
        return transformer.transformNumber(this);
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
