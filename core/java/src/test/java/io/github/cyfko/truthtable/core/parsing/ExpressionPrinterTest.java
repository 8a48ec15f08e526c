package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.impl.BasicExpressionParser;
import io.github.cyfko.truthtable.core.model.And;
import io.github.cyfko.truthtable.core.model.Expression;
import io.github.cyfko.truthtable.core.model.Not;
import io.github.cyfko.truthtable.core.model.Variable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExpressionPrinter Tests")
class ExpressionPrinterTest {

    private final BasicExpressionParser parser = new BasicExpressionParser();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "a          | a",
            "a'         | a'",
            "ab         | (a * b)",
            "a*b        | (a * b)",
            "a+bc'      | (a + (b * c'))",
            "(a+b)'     | (a + b)'",
            "a+b+c      | (a + (b + c))",
            "(a')'      | (a')'"
    })
    @DisplayName("Should print the canonical parenthesised form")
    void shouldPrintCanonicalForm(String input, String expected) {
        assertEquals(expected, ExpressionPrinter.print(parser.parse(input)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a+bc'", "((a))", "(a')'", "x(y+z)'w", "A*b + (c+d)'e"})
    @DisplayName("Should print a form that parses back to an equal tree")
    void shouldReparseToEqualTree(String input) {
        Expression tree = parser.parse(input);

        assertEquals(tree, parser.parse(ExpressionPrinter.print(tree)));
    }

    @Test
    @DisplayName("Should back toString of every node")
    void shouldBackToString() {
        Expression tree = new Not(new And(new Variable('a'), new Variable('b')));

        assertEquals("(a * b)'", tree.toString());
    }
}
