package io.github.cyfko.truthtable.core.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Lexer Tests")
class LexerTest {

    private static String symbols(List<Token> tokens) {
        return tokens.stream().map(t -> String.valueOf(t.symbol())).collect(Collectors.joining());
    }

    @Test
    @DisplayName("Should strip all whitespace and keep symbols in order")
    void shouldStripWhitespace() {
        List<Token> tokens = Lexer.tokenize(" a b' +\t( c )\n");

        assertEquals("ab'+(c)", symbols(tokens));
    }

    @Test
    @DisplayName("Should index tokens by stream position, not text position")
    void shouldIndexByStreamPosition() {
        List<Token> tokens = Lexer.tokenize("a   +   b");

        assertEquals(3, tokens.size());
        assertEquals(0, tokens.get(0).index());
        assertEquals(1, tokens.get(1).index());
        assertEquals(2, tokens.get(2).index());
    }

    @Test
    @DisplayName("Should pass unknown characters through unvalidated")
    void shouldPassThroughUnknownCharacters() {
        assertEquals("a&1#b", symbols(Lexer.tokenize("a & 1 # b")));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "\t\n  "})
    @DisplayName("Should return no tokens for null or blank text")
    void shouldReturnEmptyForBlank(String text) {
        assertTrue(Lexer.tokenize(text).isEmpty());
    }

    @Test
    @DisplayName("Should classify ASCII letters only")
    void shouldClassifyLetters() {
        List<Token> tokens = Lexer.tokenize("aZ(é");

        assertTrue(tokens.get(0).isLetter());
        assertTrue(tokens.get(1).isLetter());
        assertFalse(tokens.get(2).isLetter());
        assertFalse(tokens.get(3).isLetter());
    }
}
