package io.github.cyfko.truthtable.core.model;

import io.github.cyfko.truthtable.core.parsing.ExpressionPrinter;

import java.util.Objects;

/**
 * Logical negation, written as a postfix {@code '}.
 *
 * @param operand the negated expression
 */
public record Not(Expression operand) implements Expression {

    public Not {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
