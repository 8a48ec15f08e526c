package io.github.cyfko.truthtable.core.eval;

import io.github.cyfko.truthtable.core.exception.UnboundVariableException;
import io.github.cyfko.truthtable.core.model.And;
import io.github.cyfko.truthtable.core.model.Binding;
import io.github.cyfko.truthtable.core.model.Expression;
import io.github.cyfko.truthtable.core.model.ExpressionVisitor;
import io.github.cyfko.truthtable.core.model.Not;
import io.github.cyfko.truthtable.core.model.Or;
import io.github.cyfko.truthtable.core.model.Variable;

import java.util.Objects;

/**
 * Computes the truth value of an {@link Expression} under a {@link Binding}.
 * <p>
 * Evaluation has no side effects, so whether both operands of AND/OR are visited
 * is not observable; Java's short-circuit operators are used.
 * </p>
 *
 * <pre>{@code
 * Expression e = parser.parse("ab'");
 * Evaluator.evaluate(e, Binding.builder().bind('a', true).bind('b', false).build()); // true
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Evaluator {

    private Evaluator() {}

    /**
     * @param expression the expression to evaluate
     * @param binding    values for the expression's variables; extra entries are ignored
     * @return the truth value of the expression
     * @throws UnboundVariableException if a variable of the expression has no value in the binding
     * @throws NullPointerException if an argument is null
     */
    public static boolean evaluate(Expression expression, Binding binding) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(binding, "binding");
        return expression.accept(new BindingVisitor(binding));
    }

    private static final class BindingVisitor implements ExpressionVisitor<Boolean> {
        private final Binding binding;

        BindingVisitor(Binding binding) {
            this.binding = binding;
        }

        @Override
        public Boolean visitVariable(Variable variable) {
            return binding.valueOf(variable.name())
                    .orElseThrow(() -> new UnboundVariableException(variable.name()));
        }

        @Override
        public Boolean visitNot(Not not) {
            return !not.operand().accept(this);
        }

        @Override
        public Boolean visitAnd(And and) {
            return and.left().accept(this) && and.right().accept(this);
        }

        @Override
        public Boolean visitOr(Or or) {
            return or.left().accept(this) || or.right().accept(this);
        }
    }
}
