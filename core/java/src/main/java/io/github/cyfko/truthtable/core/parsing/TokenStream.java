package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;

import java.util.List;
import java.util.Objects;

/**
 * Parser state: a token list and a cursor into it.
 * <p>
 * Offers exactly one token of lookahead. A stream belongs to a single parse call and is
 * not thread-safe.
 * </p>
 */
public final class TokenStream {

    private final List<Token> tokens;
    private int cursor;

    public TokenStream(List<Token> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        this.cursor = 0;
    }

    public static TokenStream of(String text) {
        return new TokenStream(Lexer.tokenize(text));
    }

    /**
     * @return the next token, or {@code null} at end of input
     */
    public Token peek() {
        return cursor < tokens.size() ? tokens.get(cursor) : null;
    }

    public boolean atEnd() {
        return cursor >= tokens.size();
    }

    /**
     * @return the index of the next token, or the token count at end of input
     */
    public int position() {
        return cursor;
    }

    /**
     * Consumes the next token if it is the given symbol.
     *
     * @return true if a token was consumed
     */
    public boolean consumeIf(char symbol) {
        Token next = peek();
        if (next != null && next.is(symbol)) {
            cursor++;
            return true;
        }
        return false;
    }

    /**
     * Consumes the next token if it is the given symbol, fails otherwise.
     */
    public ParseResult<Token> expect(char symbol) {
        Token next = peek();
        if (next == null || !next.is(symbol)) {
            return ParseResult.failure("'" + symbol + "'", describeNext(), cursor);
        }
        cursor++;
        return ParseResult.success(next);
    }

    /**
     * Consumes the next token if it is a letter, fails otherwise.
     */
    public ParseResult<Token> expectLetter() {
        Token next = peek();
        if (next == null || !next.isLetter()) {
            return ParseResult.failure("variable", describeNext(), cursor);
        }
        cursor++;
        return ParseResult.success(next);
    }

    /**
     * @return the next token quoted, or {@link ExpressionSyntaxException#END_OF_INPUT}
     */
    public String describeNext() {
        Token next = peek();
        return next == null ? ExpressionSyntaxException.END_OF_INPUT : next.describe();
    }
}
