package io.github.cyfko.truthtable.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of evaluating an expression for every binding of its variables.
 * <p>
 * {@link #variables()} gives the column order (order of first appearance in the expression)
 * and {@link #rows()} the row order (binary counter, last variable toggling fastest).
 * </p>
 *
 * @param expression the evaluated expression
 * @param variables  the distinct variables of the expression, in column order
 * @param rows       one row per binding, {@code 2^N} rows in total
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTable(Expression expression, List<Character> variables, List<Row> rows) {

    public TruthTable {
        Objects.requireNonNull(expression, "expression");
        variables = List.copyOf(variables);
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * @return bindings for which the expression is true, in row order
     */
    public List<Binding> satisfyingBindings() {
        return rows.stream()
                .filter(Row::result)
                .map(Row::binding)
                .collect(Collectors.toList());
    }

    /**
     * One line of the table.
     *
     * @param binding the values of the variables
     * @param result  the value of the expression under that binding
     */
    public record Row(Binding binding, boolean result) {

        public Row {
            Objects.requireNonNull(binding, "binding");
        }
    }
}
