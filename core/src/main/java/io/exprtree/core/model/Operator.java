package io.exprtree.core.model;

import io.exprtree.core.error.UnknownOperatorException;

/** The four arithmetic operators a {@link BinaryOperation} can apply. */
public enum Operator {
    ADD('+'),
    SUBTRACT('-'),
    MULTIPLY('*'),
    DIVIDE('/');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    /** The infix symbol, e.g. {@code '+'}. */
    public char symbol() {
        return symbol;
    }

    /** Applies this operator with IEEE-754 double arithmetic. Division by zero is not trapped. */
    public double apply(double left, double right) {
        return switch (this) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> left / right;
        };
    }

    /**
     * Resolves an operator from its infix symbol.
     *
     * @param symbol one of {@code + - * /}
     * @return the matching operator
     * @throws UnknownOperatorException for any other symbol
     */
    public static Operator fromSymbol(char symbol) {
        for (Operator operator : values()) {
            if (operator.symbol == symbol) {
                return operator;
            }
        }
        throw new UnknownOperatorException(symbol);
    }
}
