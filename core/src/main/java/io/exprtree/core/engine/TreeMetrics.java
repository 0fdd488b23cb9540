package io.exprtree.core.engine;

import io.exprtree.core.model.Expression;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Shape measurements over an expression tree. Walks the tree with an explicit work stack, so it
 * is safe on trees too deep to evaluate recursively.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class TreeMetrics {

    private TreeMetrics() {}

    /**
     * Returns the number of nodes on the longest root-to-leaf path. A lone leaf has depth 1.
     *
     * @param root the tree root
     * @return the depth, at least 1
     */
    public static int depth(Expression root) {
        Objects.requireNonNull(root, "root must not be null");
        Deque<Expression> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);

        int max = 0;
        while (!nodes.isEmpty()) {
            Expression node = nodes.pop();
            int depth = depths.pop();
            max = Math.max(max, depth);
            for (Expression child : node.children()) {
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return max;
    }

    /**
     * Returns the total number of nodes in the tree.
     *
     * @param root the tree root
     * @return the node count, at least 1
     */
    public static int nodeCount(Expression root) {
        Objects.requireNonNull(root, "root must not be null");
        Deque<Expression> pending = new ArrayDeque<>();
        pending.push(root);

        int count = 0;
        while (!pending.isEmpty()) {
            Expression node = pending.pop();
            count++;
            node.children().forEach(pending::push);
        }
        return count;
    }
}
