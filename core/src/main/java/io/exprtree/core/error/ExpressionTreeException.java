package io.exprtree.core.error;

/**
 * Abstract base for all expr-tree exceptions. Never thrown directly; use the concrete subclasses,
 * either {@link UnknownOperatorException} for construction failures or one of the {@link
 * ExpressionEvalException} types for evaluation failures.
 */
public abstract class ExpressionTreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        CONSTRUCTION,
        EVALUATION
    }

    private final Phase phase;

    protected ExpressionTreeException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ExpressionTreeException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
