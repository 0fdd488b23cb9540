package io.exprtree.core.engine;

/**
 * How {@link TreeEngine#evaluate} reports evaluation failures.
 *
 * <ul>
 *   <li>{@link #LENIENT}: failures degrade to fallback values ({@code 0.0} for an unknown function,
 *       infinity or NaN for domain errors). Matches {@link
 *       io.exprtree.core.model.Expression#evaluate()}.
 *   <li>{@link #STRICT}: failures are thrown as {@link
 *       io.exprtree.core.error.ExpressionEvalException} subclasses.
 * </ul>
 */
public enum EvaluationMode {
    LENIENT,
    STRICT
}
