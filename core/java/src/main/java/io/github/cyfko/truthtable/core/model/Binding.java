package io.github.cyfko.truthtable.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable assignment of boolean values to variables.
 * <p>
 * Iteration order is the order in which variables were bound, which for generated tables
 * is the variable order of the expression.
 * </p>
 *
 * <pre>{@code
 * Binding binding = Binding.builder().bind('a', true).bind('b', false).build();
 * binding.valueOf('a');   // Optional[true]
 * binding.valueOf('z');   // Optional.empty
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Binding {

    private static final Binding EMPTY = new Binding(new LinkedHashMap<>());

    private final Map<Character, Boolean> values;

    private Binding(LinkedHashMap<Character, Boolean> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Binding empty() {
        return EMPTY;
    }

    /**
     * Copies the given map, keeping its iteration order.
     *
     * @throws NullPointerException if the map, a key or a value is null
     */
    public static Binding of(Map<Character, Boolean> values) {
        Objects.requireNonNull(values, "values");
        Builder builder = builder();
        values.forEach(builder::bind);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param variable the variable name
     * @return the bound value, or empty if the variable is not bound
     */
    public Optional<Boolean> valueOf(char variable) {
        return Optional.ofNullable(values.get(variable));
    }

    public boolean isBound(char variable) {
        return values.containsKey(variable);
    }

    /**
     * @return the bound variables, in binding order
     */
    public List<Character> variables() {
        return List.copyOf(values.keySet());
    }

    /**
     * @return the bound values, in binding order
     */
    public List<Boolean> values() {
        return new ArrayList<>(values.values());
    }

    public Map<Character, Boolean> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Binding other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Binding[");
        String separator = "";
        for (Map.Entry<Character, Boolean> entry : values.entrySet()) {
            sb.append(separator).append(entry.getKey()).append('=').append(entry.getValue() ? 1 : 0);
            separator = ", ";
        }
        return sb.append(']').toString();
    }

    public static final class Builder {
        private final LinkedHashMap<Character, Boolean> values = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Binds a variable; binding the same variable again replaces its value but keeps its position.
         */
        public Builder bind(Character variable, Boolean value) {
            values.put(Objects.requireNonNull(variable, "variable"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Binding build() {
            return values.isEmpty() ? EMPTY : new Binding(new LinkedHashMap<>(values));
        }
    }
}
