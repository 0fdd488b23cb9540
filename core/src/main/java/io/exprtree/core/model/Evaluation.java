package io.exprtree.core.model;

import io.exprtree.core.error.ArithmeticDomainException;
import io.exprtree.core.error.UnknownFunctionException;
import java.util.Objects;

/**
 * Outcome of a checked evaluation. Exactly one of three states:
 *
 * <ul>
 * <li>{@link Status#OK}: the tree evaluated cleanly.
 * <li>{@link Status#UNKNOWN_FUNCTION}: a function call named a function missing from {@link
 * MathFunction}.
 * <li>{@link Status#DOMAIN_ERROR}: an operation left its domain (division by zero, square root of
 * a negative number, {@code inf - inf}).
 * </ul>
 *
 * <p>Whatever the status, {@link #value()} holds the value plain {@link Expression#evaluate()}
 * returns for the same tree, so lenient callers can always fall back to it.
 */
public final class Evaluation {

    /** The kind of evaluation outcome. */
    public enum Status {
        OK,
        UNKNOWN_FUNCTION,
        DOMAIN_ERROR
    }

    private final Status status;
    private final double value;
    private final String detail;
    private final String functionName;

    private Evaluation(Status status, double value, String detail, String functionName) {
        this.status = status;
        this.value = value;
        this.detail = detail;
        this.functionName = functionName;
    }

    /** Creates an OK result. */
    public static Evaluation ok(double value) {
        return new Evaluation(Status.OK, value, null, null);
    }

    /** Creates an UNKNOWN_FUNCTION result carrying the fallback value {@code 0.0}. */
    public static Evaluation unknownFunction(String functionName) {
        Objects.requireNonNull(functionName, "functionName must not be null for UNKNOWN_FUNCTION");
        return new Evaluation(
                Status.UNKNOWN_FUNCTION,
                FunctionCall.UNKNOWN_FUNCTION_VALUE,
                "Unknown function: '" + functionName + "'",
                functionName);
    }

    /** Creates a DOMAIN_ERROR result carrying the IEEE-754 value the operation produced. */
    public static Evaluation domainError(double value, String detail) {
        Objects.requireNonNull(detail, "detail must not be null for DOMAIN_ERROR");
        return new Evaluation(Status.DOMAIN_ERROR, value, detail, null);
    }

    /** Same status and detail, different value. Used when a failure propagates to a parent node. */
    Evaluation withValue(double newValue) {
        return new Evaluation(status, newValue, detail, functionName);
    }

    public Status status() {
        return status;
    }

    /** The reference-compatible value, present for every status. */
    public double value() {
        return value;
    }

    /** Failure description, or {@code null} for OK. */
    public String detail() {
        return detail;
    }

    /** The unresolved function name for UNKNOWN_FUNCTION, otherwise {@code null}. */
    public String functionName() {
        return functionName;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * Returns the value, or raises the failure as an exception.
     *
     * @throws UnknownFunctionException for UNKNOWN_FUNCTION
     * @throws ArithmeticDomainException for DOMAIN_ERROR
     */
    public double orElseThrow() {
        return switch (status) {
            case OK -> value;
            case UNKNOWN_FUNCTION -> throw new UnknownFunctionException(detail, functionName);
            case DOMAIN_ERROR -> throw new ArithmeticDomainException(detail, value);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Evaluation that)) return false;
        return status == that.status
                && Double.compare(value, that.value) == 0
                && Objects.equals(detail, that.detail)
                && Objects.equals(functionName, that.functionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, value, detail, functionName);
    }

    @Override
    public String toString() {
        return switch (status) {
            case OK -> "Evaluation[OK, value=" + value + "]";
            case UNKNOWN_FUNCTION, DOMAIN_ERROR -> "Evaluation[" + status + ", value=" + value + ", detail=" + detail
                    + "]";
        };
    }
}
