package io.exprtree.core.error;

/**
 * Thrown when an operation leaves its arithmetic domain, e.g. division by zero or the square root
 * of a negative number. URN: {@code urn:expr-tree:error:arithmetic-domain}
 */
public final class ArithmeticDomainException extends ExpressionEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:expr-tree:error:arithmetic-domain";

    private final double value;

    public ArithmeticDomainException(String message, double value) {
        super(message);
        this.value = value;
    }

    /** The IEEE-754 value the operation produced (infinity or NaN). */
    public double value() {
        return value;
    }
}
