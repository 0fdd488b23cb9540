package io.exprtree.core.error;

/**
 * Thrown when a function call names a function missing from the built-in registry. URN: {@code
 * urn:expr-tree:error:unknown-function}
 */
public final class UnknownFunctionException extends ExpressionEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:expr-tree:error:unknown-function";

    private final String functionName;

    public UnknownFunctionException(String message, String functionName) {
        super(message);
        this.functionName = functionName;
    }

    /** The unresolved function name. */
    public String functionName() {
        return functionName;
    }
}
