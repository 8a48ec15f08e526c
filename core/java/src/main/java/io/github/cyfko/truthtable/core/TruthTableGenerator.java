package io.github.cyfko.truthtable.core;

import io.github.cyfko.truthtable.core.api.ExpressionParser;
import io.github.cyfko.truthtable.core.api.TableRenderer;
import io.github.cyfko.truthtable.core.config.TablePolicy;
import io.github.cyfko.truthtable.core.eval.BindingEnumerator;
import io.github.cyfko.truthtable.core.eval.Evaluator;
import io.github.cyfko.truthtable.core.eval.VariableCollector;
import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;
import io.github.cyfko.truthtable.core.exception.VariableLimitException;
import io.github.cyfko.truthtable.core.impl.BasicExpressionParser;
import io.github.cyfko.truthtable.core.impl.TextTableRenderer;
import io.github.cyfko.truthtable.core.model.Binding;
import io.github.cyfko.truthtable.core.model.Expression;
import io.github.cyfko.truthtable.core.model.TruthTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point of the library: parses an expression and builds its truth table.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link ExpressionParser#parse(String)} builds the {@link Expression} tree</li>
 *   <li>{@link VariableCollector#collect(Expression)} lists its variables in order of first appearance</li>
 *   <li>{@link BindingEnumerator#enumerate(List, TablePolicy)} produces the {@code 2^N} bindings</li>
 *   <li>{@link Evaluator#evaluate(Expression, Binding)} computes each row's result</li>
 *   <li>{@link TableRenderer#render(TruthTable)} formats the table (for {@link #render(String)})</li>
 * </ol>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * TruthTableGenerator generator = new TruthTableGenerator();
 *
 * TruthTable table = generator.generate("a + bc'");
 * table.rowCount();   // 8
 *
 * System.out.print(generator.render("(a+b)'"));
 * // a b out
 * // 0 0 1
 * // 0 1 0
 * // 1 0 0
 * // 1 1 0
 * }</pre>
 *
 * <p>Instances hold no mutable state and can be shared.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TruthTableGenerator {

    private static final Logger log = Logger.getLogger(TruthTableGenerator.class.getName());

    private final ExpressionParser parser;
    private final TablePolicy tablePolicy;
    private final TableRenderer renderer;

    /**
     * Uses {@link BasicExpressionParser} defaults and {@link TablePolicy#defaults()}.
     */
    public TruthTableGenerator() {
        this(new BasicExpressionParser(), TablePolicy.defaults());
    }

    /**
     * Renders with a {@link TextTableRenderer} configured from the table policy.
     */
    public TruthTableGenerator(ExpressionParser parser, TablePolicy tablePolicy) {
        this(parser, tablePolicy, new TextTableRenderer(Objects.requireNonNull(tablePolicy, "tablePolicy")));
    }

    public TruthTableGenerator(ExpressionParser parser, TablePolicy tablePolicy, TableRenderer renderer) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.tablePolicy = Objects.requireNonNull(tablePolicy, "tablePolicy");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /**
     * Parses and tabulates an expression.
     *
     * @param text the expression text
     * @return the truth table
     * @throws ExpressionSyntaxException if the text does not parse
     * @throws VariableLimitException if the expression has too many variables
     */
    public TruthTable generate(String text) {
        return generate(parser.parse(text));
    }

    /**
     * Tabulates an already parsed expression.
     *
     * @param expression the expression
     * @return the truth table
     * @throws VariableLimitException if the expression has too many variables
     */
    public TruthTable generate(Expression expression) {
        Objects.requireNonNull(expression, "expression");

        long start = System.nanoTime();
        List<Character> variables = VariableCollector.collect(expression);
        List<Binding> bindings = BindingEnumerator.enumerate(variables, tablePolicy);

        List<TruthTable.Row> rows = new ArrayList<>(bindings.size());
        for (Binding binding : bindings) {
            rows.add(new TruthTable.Row(binding, Evaluator.evaluate(expression, binding)));
        }
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        log.fine(() -> String.format(
                "Truth table for %s: %d variables %s, %d rows in %d ms",
                expression, variables.size(), variables, rows.size(), durationMs
        ));

        return new TruthTable(expression, variables, rows);
    }

    /**
     * Parses, tabulates and renders an expression.
     * <p>
     * A syntax error propagates before anything is rendered: no partial table is produced.
     * </p>
     *
     * @param text the expression text
     * @return the rendered table
     * @throws ExpressionSyntaxException if the text does not parse
     * @throws VariableLimitException if the expression has too many variables
     */
    public String render(String text) {
        return renderer.render(generate(text));
    }

    public ExpressionParser getParser() {
        return parser;
    }

    public TablePolicy getTablePolicy() {
        return tablePolicy;
    }

    public TableRenderer getRenderer() {
        return renderer;
    }
}
