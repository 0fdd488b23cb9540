package io.exprtree.core.model;

import java.util.Optional;

/**
 * Registry of the unary functions a {@link FunctionCall} can name. The registry is fixed; names
 * are matched case-sensitively.
 */
public enum MathFunction {
    SQRT("sqrt"),
    ABS("abs");

    private final String functionName;

    MathFunction(String functionName) {
        this.functionName = functionName;
    }

    /** The name used in a {@link FunctionCall}. */
    public String functionName() {
        return functionName;
    }

    /** Applies the function. A negative argument to {@code sqrt} yields NaN. */
    public double apply(double argument) {
        return switch (this) {
            case SQRT -> Math.sqrt(argument);
            case ABS -> Math.abs(argument);
        };
    }

    /**
     * Looks up a function by name.
     *
     * @param name the function name, e.g. {@code "sqrt"}
     * @return the function, or empty if the name is not registered
     */
    public static Optional<MathFunction> lookup(String name) {
        for (MathFunction function : values()) {
            if (function.functionName.equals(name)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }
}
