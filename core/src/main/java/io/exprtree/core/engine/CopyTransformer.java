package io.exprtree.core.engine;

import io.exprtree.core.model.BinaryOperation;
import io.exprtree.core.model.Expression;
import io.exprtree.core.model.FunctionCall;
import io.exprtree.core.model.Number;
import io.exprtree.core.model.Variable;
import io.exprtree.core.spi.Transformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural deep copy. Rebuilds every node of the source tree; the result is {@code equals} to
 * the source but no node instance is shared between them.
 *
 * <p>Thread-safe: holds no state.
 */
public final class CopyTransformer implements Transformer {

    private static final Logger LOG = LoggerFactory.getLogger(CopyTransformer.class);

    /** Shared instance. */
    public static final CopyTransformer INSTANCE = new CopyTransformer();

    @Override
    public Expression transformNumber(Number number) {
        return new Number(number.value());
    }

    @Override
    public Expression transformVariable(Variable variable) {
        return new Variable(variable.name(), variable.value());
    }

    @Override
    public Expression transformBinaryOperation(BinaryOperation operation) {
        Expression left = operation.left().transform(this);
        Expression right = operation.right().transform(this);
        LOG.trace("Copied binary operation: {}", operation.operator());
        return new BinaryOperation(left, operation.operator(), right);
    }

    @Override
    public Expression transformFunctionCall(FunctionCall call) {
        Expression argument = call.argument().transform(this);
        LOG.trace("Copied function call: {}", call.name());
        return new FunctionCall(call.name(), argument);
    }
}
