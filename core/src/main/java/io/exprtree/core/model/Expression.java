package io.exprtree.core.model;

import io.exprtree.core.spi.Transformer;
import java.util.List;

/**
 * A node of an immutable arithmetic expression tree. The set of variants is closed: every node is
 * exactly one of {@link Number}, {@link Variable}, {@link BinaryOperation} or {@link
 * FunctionCall}.
 *
 * <p>Nodes are created once and never mutated, so a tree may be read concurrently without
 * synchronization. Trees are finite and acyclic; a node never appears twice in the same tree.
 */
public sealed interface Expression permits Number, Variable, BinaryOperation, FunctionCall {

    /**
     * Evaluates this node, recursing into its children. Never throws for arithmetic problems:
     * division by zero and domain errors follow IEEE-754 (infinity or NaN) and an unknown function
     * name yields {@code 0.0}.
     *
     * @return the numeric value of this subtree
     */
    double evaluate();

    /**
     * Evaluates this node like {@link #evaluate()} and additionally reports the first failure met
     * in a depth-first, left-to-right walk. {@code evaluateChecked().value()} always equals {@code
     * evaluate()}.
     *
     * @return the evaluation outcome, never {@code null}
     */
    Evaluation evaluateChecked();

    /**
     * Dispatches to the {@code transformer} method matching this node's variant and returns what
     * that method builds. The receiver and its subtree are left untouched.
     *
     * @param transformer the transformation to apply
     * @return the node produced by the transformer
     * @throws NullPointerException if {@code transformer} is {@code null}
     */
    Expression transform(Transformer transformer);

    /** Direct children of this node, left to right. Empty for leaves. */
    List<Expression> children();
}
