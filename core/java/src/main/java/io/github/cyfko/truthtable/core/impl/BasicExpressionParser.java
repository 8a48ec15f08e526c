package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.api.ExpressionParser;
import io.github.cyfko.truthtable.core.config.ParserPolicy;
import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;
import io.github.cyfko.truthtable.core.model.Expression;
import io.github.cyfko.truthtable.core.model.Not;
import io.github.cyfko.truthtable.core.model.Operator;
import io.github.cyfko.truthtable.core.model.Variable;
import io.github.cyfko.truthtable.core.parsing.Lexer;
import io.github.cyfko.truthtable.core.parsing.ParseResult;
import io.github.cyfko.truthtable.core.parsing.Token;
import io.github.cyfko.truthtable.core.parsing.TokenStream;

/**
 * Recursive-descent implementation of {@link ExpressionParser}.
 * <p>
 * Each grammar rule is a method taking the shared {@link TokenStream} and returning a
 * {@link ParseResult}; the first failing rule ends the parse. The parser keeps one token of
 * lookahead and never backtracks.
 * </p>
 *
 * <h2>Design</h2>
 * <ul>
 *   <li><strong>O(n)</strong>: single pass over the tokens</li>
 *   <li><strong>Stateless</strong>: all parse state lives in a per-call {@link TokenStream},
 *   so one instance can be shared between threads</li>
 *   <li><strong>Fail-fast</strong>: over-long input is rejected before lexing
 *   (see {@link ParserPolicy})</li>
 * </ul>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser();
 * Expression tree = parser.parse("a + b*c'");
 *
 * ExpressionParser strictParser = new BasicExpressionParser(ParserPolicy.strict());
 * ParseResult<Expression> result = strictParser.tryParse(userInput);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicExpressionParser implements ExpressionParser {

    private static final char OPEN = '(';
    private static final char CLOSE = ')';

    private final ParserPolicy parserPolicy;

    /**
     * Default constructor using {@link ParserPolicy#defaults()}.
     */
    public BasicExpressionParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * @param parserPolicy the parser limits
     * @throws IllegalArgumentException if parserPolicy is null
     */
    public BasicExpressionParser(ParserPolicy parserPolicy) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.parserPolicy = parserPolicy;
    }

    public ParserPolicy getParserPolicy() {
        return parserPolicy;
    }

    /**
     * {@inheritDoc}
     * <p>
     * A null text is treated as empty and fails with "expected variable, got end of input".
     * </p>
     *
     * @throws ExpressionSyntaxException if the text exceeds {@link ParserPolicy#maxExpressionLength()}
     */
    @Override
    public ParseResult<Expression> tryParse(String text) {
        if (text != null && text.length() > parserPolicy.maxExpressionLength()) {
            throw new ExpressionSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    text.length(), parserPolicy.maxExpressionLength(), parserPolicy.policyName()
            ));
        }

        TokenStream in = new TokenStream(Lexer.tokenize(text));
        return expr(in).flatMap(expression -> {
            if (!in.atEnd()) {
                return ParseResult.failure("end of input", in.describeNext(), in.position());
            }
            return ParseResult.success(expression);
        });
    }

    // expr := term ('+' expr)?
    private ParseResult<Expression> expr(TokenStream in) {
        return term(in).flatMap(left -> {
            if (in.consumeIf(Operator.OR.symbol())) {
                return expr(in).map(right -> Operator.OR.combine(left, right));
            }
            return ParseResult.success(left);
        });
    }

    // term := prod (term)? | prod ('*' term)?
    private ParseResult<Expression> term(TokenStream in) {
        return prod(in).flatMap(left -> {
            if (startsProduct(in.peek()) || in.consumeIf(Operator.AND.symbol())) {
                return term(in).map(right -> Operator.AND.combine(left, right));
            }
            return ParseResult.success(left);
        });
    }

    // prod := var ("'")? | '(' expr ')' ("'")?
    private ParseResult<Expression> prod(TokenStream in) {
        ParseResult<Expression> atom = in.consumeIf(OPEN)
                ? expr(in).flatMap(inner -> in.expect(CLOSE).map(close -> inner))
                : variable(in);
        return atom.map(operand -> in.consumeIf(Operator.NOT.symbol()) ? new Not(operand) : operand);
    }

    private ParseResult<Expression> variable(TokenStream in) {
        return in.expectLetter().map(token -> new Variable(token.symbol()));
    }

    private static boolean startsProduct(Token next) {
        return next != null && (next.isLetter() || next.is(OPEN));
    }
}
