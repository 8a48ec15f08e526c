package io.github.cyfko.truthtable.cli;

import io.github.cyfko.truthtable.core.config.CellFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CliOptions Tests")
class CliOptionsTest {

    @Test
    @DisplayName("Should join expression words with a space")
    void shouldJoinWords() {
        CliOptions options = CliOptions.parse(new String[]{"a", "+", "b'"});

        assertEquals("a + b'", options.expression());
        assertEquals(CellFormat.BINARY, options.cellFormat());
        assertFalse(options.printAst());
        assertEquals(20, options.maxVariables());
    }

    @Test
    @DisplayName("Should read flags anywhere before --")
    void shouldReadFlags() {
        CliOptions options = CliOptions.parse(new String[]{"ab", "--boolean", "--print-ast", "--max-variables=4"});

        assertEquals("ab", options.expression());
        assertEquals(CellFormat.BOOLEAN, options.cellFormat());
        assertTrue(options.printAst());
        assertEquals(4, options.tablePolicy().maxVariables());
        assertEquals(CellFormat.BOOLEAN, options.tablePolicy().cellFormat());
    }

    @Test
    @DisplayName("Should treat everything after -- as expression text")
    void shouldStopAtDoubleDash() {
        CliOptions options = CliOptions.parse(new String[]{"--", "--boolean"});

        assertEquals("--boolean", options.expression());
        assertEquals(CellFormat.BINARY, options.cellFormat());
    }

    @Test
    @DisplayName("Should leave the expression unset when no words are given")
    void shouldLeaveExpressionUnset() {
        assertNull(CliOptions.parse(new String[]{"--boolean"}).expression());
    }

    @Test
    @DisplayName("Should reject unknown options and bad limits")
    void shouldRejectBadOptions() {
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"--max-variables=x"}));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse(new String[]{"--max-variables=31"}));
    }
}
