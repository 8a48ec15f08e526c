package io.github.cyfko.truthtable.core.eval;

import io.github.cyfko.truthtable.core.config.TablePolicy;
import io.github.cyfko.truthtable.core.exception.VariableLimitException;
import io.github.cyfko.truthtable.core.model.Binding;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Generates every assignment of a list of variables, in binary counter order.
 * <p>
 * Row {@code r} gives the variable at position {@code i} of an {@code N}-variable list the
 * value of bit {@code N-1-i} of {@code r}: the last variable is the least significant bit
 * and toggles fastest.
 * </p>
 * <pre>
 * [a, b] → (a=0,b=0), (a=0,b=1), (a=1,b=0), (a=1,b=1)
 * []     → ()                     one empty binding
 * </pre>
 *
 * <h2>Limits</h2>
 * <p>
 * The result holds {@code 2^N} bindings. Lists longer than
 * {@link TablePolicy#maxVariables()} are rejected before anything is allocated.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class BindingEnumerator {

    private BindingEnumerator() {}

    /**
     * Enumerates under {@link TablePolicy#defaults()}.
     *
     * @see #enumerate(List, TablePolicy)
     */
    public static List<Binding> enumerate(List<Character> variables) {
        return enumerate(variables, TablePolicy.defaults());
    }

    /**
     * @param variables   distinct variable names, in column order
     * @param tablePolicy supplies the variable limit
     * @return {@code 2^N} distinct, total bindings in counter order
     * @throws IllegalArgumentException if a variable appears twice
     * @throws VariableLimitException if there are more variables than the policy allows
     */
    public static List<Binding> enumerate(List<Character> variables, TablePolicy tablePolicy) {
        Objects.requireNonNull(variables, "variables");
        Objects.requireNonNull(tablePolicy, "tablePolicy");

        Set<Character> distinct = new HashSet<>(variables);
        if (distinct.size() != variables.size()) {
            throw new IllegalArgumentException("Variables must be distinct, got: " + variables);
        }

        int n = variables.size();
        if (n > tablePolicy.maxVariables()) {
            throw new VariableLimitException(n, tablePolicy.maxVariables(), String.format(
                    "Expression has %d variables (max: %d, %d rows). Policy applied: %s",
                    n, tablePolicy.maxVariables(), 1L << n, tablePolicy.policyName()
            ));
        }

        int rowCount = 1 << n;
        List<Binding> bindings = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            bindings.add(bindingForRow(variables, row));
        }
        return bindings;
    }

    /**
     * @return the binding of row {@code row} in counter order
     */
    static Binding bindingForRow(List<Character> variables, int row) {
        int n = variables.size();
        Binding.Builder builder = Binding.builder();
        for (int i = 0; i < n; i++) {
            builder.bind(variables.get(i), ((row >> (n - 1 - i)) & 1) == 1);
        }
        return builder.build();
    }
}
