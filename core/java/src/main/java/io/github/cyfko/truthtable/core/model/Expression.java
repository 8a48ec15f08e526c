package io.github.cyfko.truthtable.core.model;

import io.github.cyfko.truthtable.core.api.ExpressionParser;
import io.github.cyfko.truthtable.core.eval.Evaluator;

/**
 * Node of the abstract syntax tree of a boolean expression.
 * <p>
 * The variant is closed: a node is a {@link Variable}, a {@link Not}, an {@link And} or an
 * {@link Or}. Operations over the tree are written as {@link ExpressionVisitor}s, which the
 * compiler checks for exhaustiveness.
 * </p>
 *
 * <p><strong>Implementation Notes:</strong></p>
 * <ul>
 *   <li>Nodes are immutable records; each node owns its children and the tree is acyclic.</li>
 *   <li>Structural equality: two trees are equal when they have the same shape and variables.</li>
 *   <li>{@link Object#toString()} returns the canonical, fully parenthesised form
 *   (e.g. {@code (a + (b * c'))}), which parses back to an equal tree.</li>
 * </ul>
 *
 * @see ExpressionParser
 * @see Evaluator
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Expression permits Variable, Not, And, Or {

    /**
     * Dispatches to the visitor method matching this node's variant.
     *
     * @param visitor the visitor
     * @param <R> the visitor's result type
     * @return the visitor's result for this node
     */
    <R> R accept(ExpressionVisitor<R> visitor);
}
