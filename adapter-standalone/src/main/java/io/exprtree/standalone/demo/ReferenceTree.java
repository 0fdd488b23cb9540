package io.exprtree.standalone.demo;

import io.exprtree.core.model.BinaryOperation;
import io.exprtree.core.model.Expression;
import io.exprtree.core.model.FunctionCall;
import io.exprtree.core.model.MathFunction;
import io.exprtree.core.model.Number;
import io.exprtree.core.model.Operator;
import io.exprtree.core.model.Variable;

/** Builds the demo expression {@code abs(var * sqrt(32.0 - 16.0))}. */
public final class ReferenceTree {

    /** Name of the single variable in the tree. */
    public static final String VARIABLE_NAME = "var";

    private ReferenceTree() {}

    /**
     * Builds the tree bottom-up.
     *
     * @param variableValue value bound to {@code var}
     * @return the root {@code abs(...)} call
     */
    public static Expression build(double variableValue) {
        Expression n32 = new Number(32.0);
        Expression n16 = new Number(16.0);
        Expression minus = new BinaryOperation(n32, Operator.SUBTRACT, n16);
        Expression callSqrt = FunctionCall.of(MathFunction.SQRT, minus);
        Expression var = new Variable(VARIABLE_NAME, variableValue);
        Expression mult = new BinaryOperation(var, Operator.MULTIPLY, callSqrt);
        return FunctionCall.of(MathFunction.ABS, mult);
    }
}
