package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.config.CellFormat;
import io.github.cyfko.truthtable.core.config.TablePolicy;
import io.github.cyfko.truthtable.core.model.Binding;
import io.github.cyfko.truthtable.core.model.TruthTable;
import io.github.cyfko.truthtable.core.model.Variable;
import io.github.cyfko.truthtable.core.TruthTableGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TextTableRenderer Tests")
class TextTableRendererTest {

    private final TruthTableGenerator generator = new TruthTableGenerator();

    @Test
    @DisplayName("Should render header then rows in counter order with 0/1 cells")
    void shouldRenderBinaryTable() {
        String rendered = new TextTableRenderer().render(generator.generate("(a+b)'"));

        assertEquals(
                "a b out\n" +
                "0 0 1\n" +
                "0 1 0\n" +
                "1 0 0\n" +
                "1 1 0\n",
                rendered);
    }

    @Test
    @DisplayName("Should render true/false cells padded to the widest cell")
    void shouldRenderBooleanTable() {
        TextTableRenderer renderer = new TextTableRenderer(CellFormat.BOOLEAN, "f");

        String rendered = renderer.render(generator.generate("a'"));

        assertEquals(
                "a     f\n" +
                "false true\n" +
                "true  false\n",
                rendered);
    }

    @Test
    @DisplayName("Should use the policy header and format")
    void shouldUsePolicySettings() {
        TablePolicy policy = TablePolicy.builder().outputHeader("result").build();

        String rendered = new TextTableRenderer(policy).render(generator.generate("b+a"));

        assertTrue(rendered.startsWith("b a result\n"));
        assertEquals(5, rendered.split("\n").length);
    }

    @Test
    @DisplayName("Should render a variable-free table as a header and one row")
    void shouldRenderEmptyVariableTable() {
        TruthTable table = new TruthTable(new Variable('a'), List.of(),
                List.of(new TruthTable.Row(Binding.empty(), true)));

        assertEquals("out\n1\n", new TextTableRenderer().render(table));
    }
}
