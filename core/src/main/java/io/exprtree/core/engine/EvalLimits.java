package io.exprtree.core.engine;

/**
 * Limits applied by {@link TreeEngine} before walking a tree. Evaluation and transformation
 * recurse once per tree level, so an unbounded depth can exhaust the call stack.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxDepth maximum tree depth accepted, a single node having depth 1
 *                 (default: 1000)
 */
public record EvalLimits(int maxDepth) {

    /** Default limits: depth 1000. */
    public static final EvalLimits DEFAULT = new EvalLimits(1000);

    public EvalLimits {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
    }
}
