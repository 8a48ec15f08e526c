package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.model.Operator;

/**
 * Exception thrown when a symbol cannot be resolved to an {@link Operator}, or
 * resolves to one that cannot be used where it appears.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnknownOperatorException extends RuntimeException {

    private final char symbol;

    /**
     * @param symbol the offending symbol
     */
    public UnknownOperatorException(char symbol) {
        this(symbol, "Unknown operator '" + symbol + "'");
    }

    /**
     * @param symbol  the offending symbol
     * @param message the message describing the cause of the exception
     */
    public UnknownOperatorException(char symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }
}
