package io.exprtree.core.model;

import io.exprtree.core.spi.Transformer;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named variable whose value is bound at construction. There is no environment lookup: the
 * binding travels with the node and cannot be changed afterwards.
 *
 * @param name  identifier, {@code [A-Za-z_][A-Za-z0-9_]*}
 * @param value the bound value
 */
public record Variable(String name, double value) implements Expression {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public Variable {
        Objects.requireNonNull(name, "name must not be null");
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("variable name must be an identifier, got: '" + name + "'");
        }
    }

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
        return transformer.transformVariable(this);
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return name;
    }
}
