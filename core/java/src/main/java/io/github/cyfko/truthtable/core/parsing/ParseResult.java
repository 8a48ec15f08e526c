package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a grammar rule: either a parsed value or the {@link SyntaxError} that stopped parsing.
 * <p>
 * Rules are chained with {@link #map(Function)} and {@link #flatMap(Function)}; the first
 * failure short-circuits the rest of the chain. Instances are immutable and created via
 * {@link #success(Object)} and {@link #failure(SyntaxError)}.
 * </p>
 *
 * <pre>{@code
 * ParseResult<Expression> result = parser.tryParse("a+");
 * if (!result.isSuccess()) {
 *     System.out.println(result.error().message());
 *     // expected variable, got end of input at token 2
 * }
 * }</pre>
 *
 * @param <T> the parsed value type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ParseResult<T> {

    private final T value;
    private final SyntaxError error;

    private ParseResult(T value, SyntaxError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ParseResult<T> success(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> failure(SyntaxError error) {
        return new ParseResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> ParseResult<T> failure(String expected, String actual, int position) {
        return failure(new SyntaxError(expected, actual, position));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the parsed value
     * @throws IllegalStateException if this result is a failure
     */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value on a failed parse: " + error.message());
        }
        return value;
    }

    /**
     * @return the error, or {@code null} on success
     */
    public SyntaxError error() {
        return error;
    }

    @SuppressWarnings("unchecked")
    public <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
        if (error != null) {
            return (ParseResult<U>) this;
        }
        return success(mapper.apply(value));
    }

    @SuppressWarnings("unchecked")
    public <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> mapper) {
        if (error != null) {
            return (ParseResult<U>) this;
        }
        return mapper.apply(value);
    }

    /**
     * @return the parsed value
     * @throws ExpressionSyntaxException if this result is a failure
     */
    public T orElseThrow() {
        if (error != null) {
            throw error.toException();
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null
                ? "ParseResult[success=" + value + "]"
                : "ParseResult[failure=" + error.message() + "]";
    }
}
