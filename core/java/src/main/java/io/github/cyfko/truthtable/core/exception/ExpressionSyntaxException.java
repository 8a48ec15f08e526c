package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.ExpressionParser;
import io.github.cyfko.truthtable.core.impl.BasicExpressionParser;

/**
 * Exception thrown when an expression does not match the boolean grammar.
 * <p>
 * Each instance reports what the parser expected, what it actually found and the
 * index of the offending token in the whitespace-free token stream. Parsing stops at
 * the first mismatch: no recovery is attempted and no partial tree is returned.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("a+");
 * // → "expected variable, got end of input at token 2"
 *
 * parser.parse("(a+b");
 * // → "expected ')', got end of input at token 4"
 *
 * parser.parse("a)");
 * // → "expected end of input, got ')' at token 1"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     TruthTable table = generator.generate(userExpression);
 * } catch (ExpressionSyntaxException e) {
 *     System.err.println("error: " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ExpressionParser
 * @see BasicExpressionParser
 */
public class ExpressionSyntaxException extends RuntimeException {

    /**
     * Sentinel used for {@link #getActual()} when the token stream is exhausted.
     */
    public static final String END_OF_INPUT = "end of input";

    private final String expected;
    private final String actual;
    private final int position;

    /**
     * Constructor with an explanatory error message and no positional details.
     * <p>
     * Used for failures detected before tokenization, such as an expression exceeding
     * the configured length.
     * </p>
     *
     * @param message the message describing the cause of the exception
     */
    public ExpressionSyntaxException(String message) {
        this(message, null);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public ExpressionSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.expected = null;
        this.actual = null;
        this.position = -1;
    }

    /**
     * Constructor describing a grammar mismatch.
     *
     * @param expected the expected token or token class (e.g. {@code "variable"}, {@code "')'"})
     * @param actual   the token found, or {@link #END_OF_INPUT}
     * @param position index of the offending token in the token stream
     */
    public ExpressionSyntaxException(String expected, String actual, int position) {
        super(String.format("expected %s, got %s at token %d", expected, actual, position));
        this.expected = expected;
        this.actual = actual;
        this.position = position;
    }

    /**
     * @return the expected token or token class, or {@code null} if not a grammar mismatch
     */
    public String getExpected() {
        return expected;
    }

    /**
     * @return the token actually found, {@link #END_OF_INPUT}, or {@code null} if not a grammar mismatch
     */
    public String getActual() {
        return actual;
    }

    /**
     * @return token index of the mismatch, or {@code -1} when unknown
     */
    public int getPosition() {
        return position;
    }
}
