package io.exprtree.core.error;

/**
 * Thrown when a tree is deeper than the configured {@code max-depth}, before any recursive walk
 * starts. URN: {@code urn:expr-tree:error:tree-depth-exceeded}
 */
public final class TreeDepthExceededException extends ExpressionEvalException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:expr-tree:error:tree-depth-exceeded";

    private final int depth;
    private final int maxDepth;

    public TreeDepthExceededException(int depth, int maxDepth) {
        super("Expression tree depth " + depth + " exceeds max-depth " + maxDepth);
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    /** The measured depth of the rejected tree. */
    public int depth() {
        return depth;
    }

    /** The configured limit. */
    public int maxDepth() {
        return maxDepth;
    }
}
