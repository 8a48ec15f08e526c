package io.github.cyfko.truthtable.core.eval;

import io.github.cyfko.truthtable.core.exception.UnboundVariableException;
import io.github.cyfko.truthtable.core.impl.BasicExpressionParser;
import io.github.cyfko.truthtable.core.model.Binding;
import io.github.cyfko.truthtable.core.model.Expression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Evaluator Tests")
class EvaluatorTest {

    private final BasicExpressionParser parser = new BasicExpressionParser();

    private boolean eval(String expression, String variables, String bits) {
        Binding.Builder builder = Binding.builder();
        for (int i = 0; i < variables.length(); i++) {
            builder.bind(variables.charAt(i), bits.charAt(i) == '1');
        }
        return Evaluator.evaluate(parser.parse(expression), builder.build());
    }

    @ParameterizedTest(name = "{0} with {1}={2} -> {3}")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "a+b*c   | abc | 011 | true",
            "a+b*c   | abc | 010 | false",
            "a+b*c   | abc | 100 | true",
            "ab'     | ab  | 10  | true",
            "ab'     | ab  | 11  | false",
            "(a+b)'  | ab  | 00  | true",
            "(a+b)'  | ab  | 10  | false",
            "(ab)'   | ab  | 11  | false",
            "(ab)'   | ab  | 01  | true",
            "(a')'   | a   | 1   | true",
            "aa'     | a   | 1   | false",
            "a+a'    | a   | 0   | true"
    })
    @DisplayName("Should evaluate NOT, AND and OR with grammar precedence")
    void shouldEvaluate(String expression, String variables, String bits, boolean expected) {
        assertEquals(expected, eval(expression, variables, bits));
    }

    @Test
    @DisplayName("Should ignore extra bindings")
    void shouldIgnoreExtraBindings() {
        Binding binding = Binding.builder().bind('a', true).bind('z', false).build();

        assertTrue(Evaluator.evaluate(parser.parse("a"), binding));
    }

    @Test
    @DisplayName("Should fail on a variable missing from the binding")
    void shouldFailOnUnboundVariable() {
        Expression expression = parser.parse("a+b");
        Binding binding = Binding.builder().bind('a', false).build();

        UnboundVariableException exception = assertThrows(UnboundVariableException.class,
                () -> Evaluator.evaluate(expression, binding));

        assertEquals('b', exception.getVariable());
        assertEquals("Variable 'b' is not bound", exception.getMessage());
    }

    @Test
    @DisplayName("Should require non-null arguments")
    void shouldRequireArguments() {
        assertThrows(NullPointerException.class, () -> Evaluator.evaluate(null, Binding.empty()));
        assertThrows(NullPointerException.class, () -> Evaluator.evaluate(parser.parse("a"), null));
    }
}
