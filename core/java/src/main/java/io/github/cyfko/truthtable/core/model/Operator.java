package io.github.cyfko.truthtable.core.model;

import io.github.cyfko.truthtable.core.exception.UnknownOperatorException;

/**
 * Boolean operators of the expression language and their surface symbols.
 *
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Arity</th><th>Binding</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>NOT</td><td>'</td><td>1 (postfix)</td><td>Tightest</td><td>a'</td></tr>
 * <tr><td>AND</td><td>* or juxtaposition</td><td>2</td><td>Middle</td><td>ab, a*b</td></tr>
 * <tr><td>OR</td><td>+</td><td>2</td><td>Loosest</td><td>a+b</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Operator {
    NOT('\'', 1),
    AND('*', 2),
    OR('+', 2);

    private final char symbol;
    private final int arity;

    Operator(char symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    public char symbol() {
        return symbol;
    }

    public int arity() {
        return arity;
    }

    public boolean isBinary() {
        return arity == 2;
    }

    /**
     * Resolves an operator from its surface symbol.
     *
     * @param symbol one of {@code '}, {@code *}, {@code +}
     * @return the operator
     * @throws UnknownOperatorException if the symbol is not an operator
     */
    public static Operator fromSymbol(char symbol) {
        for (Operator operator : values()) {
            if (operator.symbol == symbol) {
                return operator;
            }
        }
        throw new UnknownOperatorException(symbol);
    }

    /**
     * Builds the binary node for this operator.
     *
     * @throws UnknownOperatorException if this operator is not binary
     */
    public Expression combine(Expression left, Expression right) {
        return switch (this) {
            case AND -> new And(left, right);
            case OR -> new Or(left, right);
            case NOT -> throw new UnknownOperatorException(symbol,
                    "Operator " + name() + " ('" + symbol + "') is not a binary operator");
        };
    }
}
