package io.github.cyfko.truthtable.core.model;

/**
 * Visitor over the {@link Expression} variants.
 * <p>
 * Implementations recurse by calling {@link Expression#accept(ExpressionVisitor)} on child nodes.
 * </p>
 *
 * @param <R> the result type
 */
public interface ExpressionVisitor<R> {

    R visitVariable(Variable variable);

    R visitNot(Not not);

    R visitAnd(And and);

    R visitOr(Or or);
}
