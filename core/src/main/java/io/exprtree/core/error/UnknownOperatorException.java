package io.exprtree.core.error;

/**
 * Thrown when a binary operation is built from an operator symbol outside {@code + - * /}. URN:
 * {@code urn:expr-tree:error:unknown-operator}
 */
public final class UnknownOperatorException extends ExpressionTreeException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:expr-tree:error:unknown-operator";

    private final char symbol;

    public UnknownOperatorException(char symbol) {
        super("Unknown binary operator: '" + symbol + "'", Phase.CONSTRUCTION);
        this.symbol = symbol;
    }

    /** The rejected operator symbol. */
    public char symbol() {
        return symbol;
    }
}
