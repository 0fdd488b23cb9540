package io.exprtree.core.spi;

import io.exprtree.core.model.BinaryOperation;
import io.exprtree.core.model.Expression;
import io.exprtree.core.model.FunctionCall;
import io.exprtree.core.model.Number;
import io.exprtree.core.model.Variable;

/**
 * Pluggable tree transformation. Provides one method per node variant; {@link
 * Expression#transform(Transformer)} picks the method for the receiver's runtime type, so new
 * transformations (pretty-printers, rewriters) can be added without touching the node classes.
 *
 * <p>Implementations that rebuild composite nodes should recurse by calling {@code
 * child.transform(this)} rather than reading the children's fields directly, so the traversal
 * keeps working for every variant. A transformer must not return a node of the source tree if the
 * caller expects an independent result.
 */
public interface Transformer {

    /**
     * Transforms a numeric literal.
     *
     * @param number the source node, never {@code null}
     * @return the resulting node
     */
    Expression transformNumber(Number number);

    /**
     * Transforms a variable.
     *
     * @param variable the source node, never {@code null}
     * @return the resulting node
     */
    Expression transformVariable(Variable variable);

    /**
     * Transforms a binary operation. Children are typically transformed first.
     *
     * @param operation the source node, never {@code null}
     * @return the resulting node
     */
    Expression transformBinaryOperation(BinaryOperation operation);

    /**
     * Transforms a function call. The argument is typically transformed first.
     *
     * @param call the source node, never {@code null}
     * @return the resulting node
     */
    Expression transformFunctionCall(FunctionCall call);
}
