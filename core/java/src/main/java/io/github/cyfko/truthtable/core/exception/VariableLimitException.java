package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.config.TablePolicy;

/**
 * Exception thrown when an expression has more distinct variables than the
 * configured {@link TablePolicy#maxVariables()} allows.
 * <p>
 * A table has {@code 2^N} rows, so the check runs before any row is built.
 * </p>
 *
 * <pre>{@code
 * new TruthTableGenerator(parser, TablePolicy.strict()).generate("abcdefghijklm");
 * // → "Expression has 13 variables (max: 12, 8192 rows). Policy applied: STRICT_POLICY"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class VariableLimitException extends RuntimeException {

    private final int variableCount;
    private final int maxVariables;

    public VariableLimitException(int variableCount, int maxVariables, String message) {
        super(message);
        this.variableCount = variableCount;
        this.maxVariables = maxVariables;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getMaxVariables() {
        return maxVariables;
    }
}
