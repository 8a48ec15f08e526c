package io.github.cyfko.truthtable.core.model;

import io.github.cyfko.truthtable.core.parsing.ExpressionPrinter;

import java.util.Objects;

/**
 * Logical disjunction, written with {@code +}.
 *
 * @param left  the left operand
 * @param right the right operand
 */
public record Or(Expression left, Expression right) implements Expression {

    public Or {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
