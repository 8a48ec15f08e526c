package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.model.And;
import io.github.cyfko.truthtable.core.model.Expression;
import io.github.cyfko.truthtable.core.model.ExpressionVisitor;
import io.github.cyfko.truthtable.core.model.Not;
import io.github.cyfko.truthtable.core.model.Operator;
import io.github.cyfko.truthtable.core.model.Or;
import io.github.cyfko.truthtable.core.model.Variable;

import java.util.Objects;

/**
 * Writes an {@link Expression} back to text in canonical form.
 * <p>
 * Every binary node is parenthesised and AND is always written with {@code *}, so the
 * tree shape is visible and the output parses back to an equal tree:
 * </p>
 * <pre>{@code
 * ExpressionPrinter.print(parser.parse("a + bc'"));     // (a + (b * c'))
 * ExpressionPrinter.print(parser.parse("(a+b)'"));      // (a + b)'
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionPrinter implements ExpressionVisitor<String> {

    private static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

    private ExpressionPrinter() {}

    public static String print(Expression expression) {
        Objects.requireNonNull(expression, "expression");
        return expression.accept(INSTANCE);
    }

    @Override
    public String visitVariable(Variable variable) {
        return String.valueOf(variable.name());
    }

    @Override
    public String visitNot(Not not) {
        String operand = not.operand().accept(this);
        // a single prime per product: a'' does not parse, (a')' does
        if (not.operand() instanceof Not) {
            operand = "(" + operand + ")";
        }
        return operand + Operator.NOT.symbol();
    }

    @Override
    public String visitAnd(And and) {
        return binary(and.left(), Operator.AND, and.right());
    }

    @Override
    public String visitOr(Or or) {
        return binary(or.left(), Operator.OR, or.right());
    }

    private String binary(Expression left, Operator operator, Expression right) {
        return "(" + left.accept(this) + " " + operator.symbol() + " " + right.accept(this) + ")";
    }
}
