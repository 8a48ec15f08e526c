package io.github.cyfko.truthtable.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Policy Tests")
class PolicyTest {

    @Nested
    @DisplayName("ParserPolicy")
    class ParserPolicyTests {

        @Test
        @DisplayName("Should expose preset limits")
        void shouldExposePresets() {
            assertEquals(1000, ParserPolicy.defaults().maxExpressionLength());
            assertEquals(256, ParserPolicy.strict().maxExpressionLength());
            assertEquals(4000, ParserPolicy.relaxed().maxExpressionLength());
            assertEquals("DEFAULT_POLICY", ParserPolicy.defaults().policyName());
        }

        @Test
        @DisplayName("Should build custom policies from defaults")
        void shouldBuildCustom() {
            ParserPolicy policy = ParserPolicy.builder().maxExpressionLength(42).build();

            assertEquals(42, policy.maxExpressionLength());
            assertEquals(PolicyName.CUSTOM_POLICY.name(), policy.policyName());
        }

        @Test
        @DisplayName("Should reject invalid values")
        void shouldRejectInvalid() {
            assertThrows(IllegalArgumentException.class, () -> new ParserPolicy("x", 0));
            assertThrows(IllegalArgumentException.class, () -> new ParserPolicy(" ", 10));
        }
    }

    @Nested
    @DisplayName("TablePolicy")
    class TablePolicyTests {

        @Test
        @DisplayName("Should expose preset settings")
        void shouldExposePresets() {
            TablePolicy defaults = TablePolicy.defaults();

            assertEquals(20, defaults.maxVariables());
            assertEquals(CellFormat.BINARY, defaults.cellFormat());
            assertEquals("out", defaults.outputHeader());
            assertEquals(12, TablePolicy.strict().maxVariables());
            assertEquals(24, TablePolicy.relaxed().maxVariables());
        }

        @Test
        @DisplayName("Should reject limits outside 0..30")
        void shouldRejectOutOfRangeLimits() {
            assertThrows(IllegalArgumentException.class, () -> TablePolicy.builder().maxVariables(-1).build());
            assertThrows(IllegalArgumentException.class,
                    () -> TablePolicy.builder().maxVariables(TablePolicy.HARD_MAX_VARIABLES + 1).build());
            assertDoesNotThrow(() -> TablePolicy.builder().maxVariables(TablePolicy.HARD_MAX_VARIABLES).build());
        }

        @Test
        @DisplayName("Should require a cell format and a header")
        void shouldRequireFormatAndHeader() {
            assertThrows(NullPointerException.class, () -> TablePolicy.builder().cellFormat(null).build());
            assertThrows(IllegalArgumentException.class, () -> TablePolicy.builder().outputHeader("").build());
        }
    }

    @Test
    @DisplayName("Should format cells per CellFormat")
    void shouldFormatCells() {
        assertEquals("1", CellFormat.BINARY.format(true));
        assertEquals("0", CellFormat.BINARY.format(false));
        assertEquals("true", CellFormat.BOOLEAN.format(true));
        assertEquals(5, CellFormat.BOOLEAN.width());
    }
}
