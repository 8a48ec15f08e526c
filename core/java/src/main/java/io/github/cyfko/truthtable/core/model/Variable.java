package io.github.cyfko.truthtable.core.model;

import io.github.cyfko.truthtable.core.parsing.ExpressionPrinter;

/**
 * Leaf node naming one boolean input.
 *
 * @param name a single ASCII letter, case-sensitive
 */
public record Variable(char name) implements Expression {

    /**
     * @throws IllegalArgumentException if name is not an ASCII letter
     */
    public Variable {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Variable name must be a letter a-z or A-Z, got: '" + name + "'");
        }
    }

    public static boolean isValidName(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
