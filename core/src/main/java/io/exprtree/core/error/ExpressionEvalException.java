package io.exprtree.core.error;

/**
 * Abstract parent for evaluation-time errors. Only raised when a caller asks for strict
 * evaluation; the lenient path reports the same conditions through fallback values instead.
 */
public abstract class ExpressionEvalException extends ExpressionTreeException {

    private static final long serialVersionUID = 1L;

    protected ExpressionEvalException(String message) {
        super(message, Phase.EVALUATION);
    }

    protected ExpressionEvalException(String message, Throwable cause) {
        super(message, cause, Phase.EVALUATION);
    }
}
