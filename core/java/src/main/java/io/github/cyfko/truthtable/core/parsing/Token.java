package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.model.Variable;

/**
 * A single significant character of an expression.
 *
 * @param symbol the character, unvalidated
 * @param index  position of the token in the token stream (whitespace excluded)
 */
public record Token(char symbol, int index) {

    public boolean isLetter() {
        return Variable.isValidName(symbol);
    }

    public boolean is(char c) {
        return symbol == c;
    }

    /**
     * @return the symbol quoted for diagnostics, e.g. {@code '+'}
     */
    public String describe() {
        return "'" + symbol + "'";
    }
}
