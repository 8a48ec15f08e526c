package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;
import io.github.cyfko.truthtable.core.model.Expression;
import io.github.cyfko.truthtable.core.parsing.ParseResult;

/**
 * Parser for transforming boolean algebra expressions into {@link Expression} trees.
 *
 * <h2>Expression Language</h2>
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Binding</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Atomic</td><td>N/A</td><td>(a + b)</td></tr>
 * <tr><td>NOT</td><td>' (postfix)</td><td>Tightest</td><td>N/A</td><td>a', (a + b)'</td></tr>
 * <tr><td>AND</td><td>* or juxtaposition</td><td>Middle</td><td>Right</td><td>ab, a * b</td></tr>
 * <tr><td>OR</td><td>+</td><td>Loosest</td><td>Right</td><td>a + b</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Grammar</h2>
 * <pre>
 * expr  := term ('+' expr)?
 * term  := prod (term)?            -- implicit AND, next token is a letter or '('
 *        | prod ('*' term)?        -- explicit AND
 * prod  := var ("'")?
 *        | '(' expr ')' ("'")?
 * var   := [a-zA-Z]
 * </pre>
 *
 * <p>Precedence is carried by the grammar shape:</p>
 * <pre>{@code
 * parser.parse("a+bc");     // a + (b * c)
 * parser.parse("ab'");      // a * (b')       NOT applies to the product before it only
 * parser.parse("(ab)'");    // (a * b)'
 * parser.parse("a+b+c");    // a + (b + c)    right-leaning
 * }</pre>
 *
 * <h2>Whitespace Handling</h2>
 * <p>Whitespace is ignored everywhere, including between a product and its {@code '}.</p>
 *
 * <h2>Error Detection</h2>
 * <pre>{@code
 * parser.parse("");         // expected variable, got end of input
 * parser.parse("a+");       // expected variable, got end of input
 * parser.parse("(a+b");     // expected ')', got end of input
 * parser.parse("a)");       // expected end of input, got ')'
 * parser.parse("a&b");      // expected end of input, got '&'
 * }</pre>
 *
 * @see Expression
 * @see ExpressionSyntaxException
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionParser {

    /**
     * Parses an expression, reporting the first grammar mismatch as an outcome value.
     *
     * @param text the expression text
     * @return the parsed tree, or the syntax error that stopped parsing
     */
    ParseResult<Expression> tryParse(String text);

    /**
     * Parses an expression.
     *
     * @param text the expression text; whitespace is ignored
     * @return the parsed tree
     * @throws ExpressionSyntaxException if the text does not match the grammar or exceeds the parser limits
     */
    default Expression parse(String text) throws ExpressionSyntaxException {
        return tryParse(text).orElseThrow();
    }
}
