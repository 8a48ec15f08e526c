package io.github.cyfko.truthtable.core.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits raw expression text into {@link Token}s.
 * <p>
 * Every expression token is one character, so lexing only removes whitespace. Other
 * characters pass through unchanged and unvalidated: rejecting them is the parser's job.
 * </p>
 *
 * <pre>{@code
 * Lexer.tokenize(" a b' + (c)")
 * // → [a, b, ', +, (, c, )] with indices 0..6
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Lexer {

    private Lexer() {}

    /**
     * @param text raw expression text, may be null
     * @return the significant characters in order; empty for null or blank text
     */
    public static List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }

        List<Token> tokens = new ArrayList<>(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            tokens.add(new Token(c, tokens.size()));
        }
        return tokens;
    }
}
