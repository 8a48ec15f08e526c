package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;

/**
 * Description of a grammar mismatch, carried by a failed {@link ParseResult}.
 *
 * @param expected the expected token or token class
 * @param actual   the token found, or {@link ExpressionSyntaxException#END_OF_INPUT}
 * @param position index of the offending token
 */
public record SyntaxError(String expected, String actual, int position) {

    public String message() {
        return String.format("expected %s, got %s at token %d", expected, actual, position);
    }

    public ExpressionSyntaxException toException() {
        return new ExpressionSyntaxException(expected, actual, position);
    }
}
