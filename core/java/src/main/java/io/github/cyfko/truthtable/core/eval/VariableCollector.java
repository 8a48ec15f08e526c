package io.github.cyfko.truthtable.core.eval;

import io.github.cyfko.truthtable.core.model.And;
import io.github.cyfko.truthtable.core.model.Expression;
import io.github.cyfko.truthtable.core.model.ExpressionVisitor;
import io.github.cyfko.truthtable.core.model.Not;
import io.github.cyfko.truthtable.core.model.Or;
import io.github.cyfko.truthtable.core.model.Variable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Lists the distinct variables of an {@link Expression}.
 * <p>
 * The tree is walked depth-first, left to right, and each variable is kept at its first
 * occurrence. The order is that of the expression, not alphabetical:
 * {@code b+a} gives {@code [b, a]}. It fixes both the column order and the enumeration
 * order of a truth table.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class VariableCollector {

    private VariableCollector() {}

    public static List<Character> collect(Expression expression) {
        Objects.requireNonNull(expression, "expression");
        Set<Character> seen = new LinkedHashSet<>();
        expression.accept(new CollectingVisitor(seen));
        return List.copyOf(seen);
    }

    private static final class CollectingVisitor implements ExpressionVisitor<Void> {
        private final Set<Character> seen;

        CollectingVisitor(Set<Character> seen) {
            this.seen = seen;
        }

        @Override
        public Void visitVariable(Variable variable) {
            seen.add(variable.name());
            return null;
        }

        @Override
        public Void visitNot(Not not) {
            return not.operand().accept(this);
        }

        @Override
        public Void visitAnd(And and) {
            and.left().accept(this);
            return and.right().accept(this);
        }

        @Override
        public Void visitOr(Or or) {
            or.left().accept(this);
            return or.right().accept(this);
        }
    }
}
