package io.exprtree.core.engine;

import io.exprtree.core.error.TreeDepthExceededException;
import io.exprtree.core.model.Evaluation;
import io.exprtree.core.model.Expression;
import io.exprtree.core.spi.Transformer;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for evaluating and transforming expression trees under configured limits.
 *
 * <p>
 * Every operation first measures the tree with {@link TreeMetrics} and rejects
 * it with {@link TreeDepthExceededException} when it is deeper than
 * {@link EvalLimits#maxDepth()}; only then does the recursive walk start.
 * Evaluation failures are reported according to the {@link EvaluationMode}.
 *
 * <p>
 * Thread-safe: immutable after construction.
 */
public final class TreeEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TreeEngine.class);

    private final EvalLimits limits;
    private final EvaluationMode mode;

    /** Creates an engine with {@link EvalLimits#DEFAULT} and {@link EvaluationMode#LENIENT}. */
    public TreeEngine() {
        this(EvalLimits.DEFAULT, EvaluationMode.LENIENT);
    }

    public TreeEngine(EvalLimits limits, EvaluationMode mode) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public EvalLimits limits() {
        return limits;
    }

    public EvaluationMode mode() {
        return mode;
    }

    /**
     * Evaluates a tree.
     *
     * @param root the tree root
     * @return the value; in LENIENT mode a failed evaluation returns its fallback value
     * @throws TreeDepthExceededException if the tree is deeper than the limit
     * @throws io.exprtree.core.error.ExpressionEvalException in STRICT mode, if evaluation fails
     */
    public double evaluate(Expression root) {
        Evaluation evaluation = evaluateChecked(root);
        if (evaluation.isOk()) {
            return evaluation.value();
        }
        if (mode == EvaluationMode.STRICT) {
            return evaluation.orElseThrow();
        }
        LOG.debug(
                "Evaluation degraded to fallback: status={}, value={}, detail={}",
                evaluation.status(),
                evaluation.value(),
                evaluation.detail());
        return evaluation.value();
    }

    /**
     * Evaluates a tree and returns the full outcome regardless of mode.
     *
     * @throws TreeDepthExceededException if the tree is deeper than the limit
     */
    public Evaluation evaluateChecked(Expression root) {
        int depth = checkDepth(root);
        Evaluation evaluation = root.evaluateChecked();
        LOG.debug("Evaluated tree: depth={}, status={}, value={}", depth, evaluation.status(), evaluation.value());
        return evaluation;
    }

    /**
     * Applies a transformer to a tree.
     *
     * @param root        the source tree, left unchanged
     * @param transformer the transformation
     * @return the transformed tree
     * @throws TreeDepthExceededException if the tree is deeper than the limit
     */
    public Expression transform(Expression root, Transformer transformer) {
        Objects.requireNonNull(transformer, "transformer must not be null");
        int depth = checkDepth(root);
        Expression result = root.transform(transformer);
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Transformed tree: transformer={}, depth={}, nodes={}",
                    transformer.getClass().getSimpleName(),
                    depth,
                    TreeMetrics.nodeCount(result));
        }
        return result;
    }

    /** Deep-copies a tree with {@link CopyTransformer}. */
    public Expression copy(Expression root) {
        return transform(root, CopyTransformer.INSTANCE);
    }

    private int checkDepth(Expression root) {
        Objects.requireNonNull(root, "root must not be null");
        int depth = TreeMetrics.depth(root);
        if (depth > limits.maxDepth()) {
            LOG.warn("Rejected tree: depth {} exceeds max-depth {}", depth, limits.maxDepth());
            throw new TreeDepthExceededException(depth, limits.maxDepth());
        }
        return depth;
    }
}
