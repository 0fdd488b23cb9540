package io.exprtree.core.model;

import io.exprtree.core.spi.Transformer;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies a named unary function to a single argument. The name is resolved against {@link
 * MathFunction} at evaluation time, not at construction: an unknown name is a valid node that
 * evaluates to {@link #UNKNOWN_FUNCTION_VALUE}.
 *
 * @param name     the function name, e.g. {@code "sqrt"}
 * @param argument the argument expression
 */
public record FunctionCall(String name, Expression argument) implements Expression {

    /** Value an unknown function evaluates to. */
    public static final double UNKNOWN_FUNCTION_VALUE = 0.0;

    public FunctionCall {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(argument, "argument must not be null");
    }

    /** Builds a call to a registered function. */
    public static FunctionCall of(MathFunction function, Expression argument) {
        return new FunctionCall(function.functionName(), argument);
    }

    /** The registered function this call names, or empty if the name is unknown. */
    public Optional<MathFunction> function() {
        return MathFunction.lookup(name);
    }

    @Override
    public double evaluate() {
        double argumentValue = argument.evaluate();
        Optional<MathFunction> function = function();
        return function.isPresent() ? function.get().apply(argumentValue) : UNKNOWN_FUNCTION_VALUE;
    }

    @Override
    public Evaluation evaluateChecked() {
        Evaluation argumentResult = argument.evaluateChecked();
        Optional<MathFunction> function = function();
        if (function.isEmpty()) {
            // the argument's own failure is reported first, it happened earlier in the walk
            return argumentResult.isOk()
                    ? Evaluation.unknownFunction(name)
                    : argumentResult.withValue(UNKNOWN_FUNCTION_VALUE);
        }

        double result = function.get().apply(argumentResult.value());
        if (!argumentResult.isOk()) {
            return argumentResult.withValue(result);
        }
        if (Double.isNaN(result) && !Double.isNaN(argumentResult.value())) {
            return Evaluation.domainError(result, name + "(" + argumentResult.value() + ") is undefined");
        }
        return Evaluation.ok(result);
    }

    @Override
    public Expression transform(Transformer transformer) {
        Objects.requireNonNull(transformer, "transformer must not be null");
        return transformer.transformFunctionCall(this);
    }

    @Override
    public List<Expression> children() {
        return List.of(argument);
    }

    @Override
    public String toString() {
        return name + "(" + argument + ")";
    }
}
