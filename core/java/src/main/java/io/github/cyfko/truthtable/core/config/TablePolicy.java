package io.github.cyfko.truthtable.core.config;

import java.util.Objects;

/**
 * Configuration for truth table generation and rendering.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>maxVariables</strong>: Maximum distinct variables in an expression (default: 20,
 *   hard ceiling: {@value #HARD_MAX_VARIABLES}). A table has {@code 2^N} rows.</li>
 *   <li><strong>cellFormat</strong>: {@link CellFormat#BINARY} ({@code 0/1}, default) or
 *   {@link CellFormat#BOOLEAN} ({@code true/false})</li>
 *   <li><strong>outputHeader</strong>: Header of the result column (default: {@code out})</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * TablePolicy policy = TablePolicy.defaults();   // 20 variables
 * TablePolicy policy = TablePolicy.strict();     // 12 variables
 * TablePolicy policy = TablePolicy.relaxed();    // 24 variables
 *
 * TablePolicy policy = TablePolicy.builder()
 *     .cellFormat(CellFormat.BOOLEAN)
 *     .outputHeader("f")
 *     .build();
 * }</pre>
 *
 * @param policyName   name reported in limit violations
 * @param maxVariables maximum number of distinct variables
 * @param cellFormat   rendering of boolean cells
 * @param outputHeader header of the result column
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TablePolicy(
    String policyName,
    int maxVariables,
    CellFormat cellFormat,
    String outputHeader
) {

    /**
     * Upper bound for {@link #maxVariables()}: row indices must fit in an {@code int}.
     */
    public static final int HARD_MAX_VARIABLES = 30;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if a value is out of range
     * @throws NullPointerException if cellFormat is null
     */
    public TablePolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxVariables < 0 || maxVariables > HARD_MAX_VARIABLES) {
            throw new IllegalArgumentException(String.format(
                "maxVariables must be between 0 and %d, got: %d", HARD_MAX_VARIABLES, maxVariables));
        }
        Objects.requireNonNull(cellFormat, "cellFormat");
        if (outputHeader == null || outputHeader.isBlank()) {
            throw new IllegalArgumentException("outputHeader is required");
        }
    }

    public static TablePolicy defaults() {
        return new TablePolicy(PolicyName.DEFAULT_POLICY.name(), 20, CellFormat.BINARY, "out");
    }

    public static TablePolicy strict() {
        return new TablePolicy(PolicyName.STRICT_POLICY.name(), 12, CellFormat.BINARY, "out");
    }

    public static TablePolicy relaxed() {
        return new TablePolicy(PolicyName.RELAXED_POLICY.name(), 24, CellFormat.BINARY, "out");
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxVariables = 20;
        private CellFormat _cellFormat = CellFormat.BINARY;
        private String _outputHeader = "out";

        private Builder() {}

        public TablePolicy build() {
            return new TablePolicy(_policyName, _maxVariables, _cellFormat, _outputHeader);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxVariables(int maxVariables) { this._maxVariables = maxVariables; return this; }
        public Builder cellFormat(CellFormat cellFormat) { this._cellFormat = cellFormat; return this; }
        public Builder outputHeader(String outputHeader) { this._outputHeader = outputHeader; return this; }
    }
}
