package io.github.cyfko.truthtable.core.model;

import io.github.cyfko.truthtable.core.parsing.ExpressionPrinter;

import java.util.Objects;

/**
 * Logical conjunction, written by juxtaposition ({@code ab}) or with {@code *}.
 * Both spellings produce the same node.
 *
 * @param left  the left operand
 * @param right the right operand
 */
public record And(Expression left, Expression right) implements Expression {

    public And {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
