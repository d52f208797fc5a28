package com.procflow.core.engine.node.executor.support;

import com.procflow.integration.enumerations.ProcFlowFieldType;
import com.procflow.integration.models.commons.FileReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Field Value Coercer Tests")
class FieldValueCoercerTest {

    // ========================================================================
    // NUMBERS
    // ========================================================================

    @Nested
    @DisplayName("Numbers")
    class NumberTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "$1,250.00 | 1250.0",
                "1 250.5   | 1250.5",
                "(42.10)   | -42.1",
                "EUR 7.25  | 7.25"
        })
        @DisplayName("Should strip currency formatting")
        void shouldStripCurrencyFormatting(String raw, double expected) {
            assertEquals(expected, FieldValueCoercer.coerce(raw, ProcFlowFieldType.CURRENCY));
        }

        @Test
        @DisplayName("Should keep integral text as a long")
        void shouldKeepIntegralTextAsLong() {
            assertEquals(1200L, FieldValueCoercer.coerce("1,200", ProcFlowFieldType.NUMBER));
        }

        @Test
        @DisplayName("Should normalize numeric values")
        void shouldNormalizeNumbers() {
            assertEquals(5L, FieldValueCoercer.coerce(5, ProcFlowFieldType.NUMBER));
            assertEquals(2.5, FieldValueCoercer.coerce(2.5f, ProcFlowFieldType.NUMBER));
        }

        @Test
        @DisplayName("Should leave text without digits unchanged")
        void shouldLeaveNonNumericText() {
            assertEquals("n/a", FieldValueCoercer.coerce("n/a", ProcFlowFieldType.NUMBER));
        }
    }

    // ========================================================================
    // DATES
    // ========================================================================

    @Nested
    @DisplayName("Dates")
    class DateTests {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
                "03/15/2026     | 2026-03-15",
                "15.03.2026     | 2026-03-15",
                "2026/03/15     | 2026-03-15",
                "March 15, 2026 | 2026-03-15",
                "Mar 15, 2026   | 2026-03-15",
                "15 March 2026  | 2026-03-15",
                "2026-03-15     | 2026-03-15"
        })
        @DisplayName("Should normalize common date formats to ISO-8601")
        void shouldNormalizeDates(String raw, String expected) {
            assertEquals(expected, FieldValueCoercer.coerce(raw, ProcFlowFieldType.DATE));
        }

        @Test
        @DisplayName("Should leave unparseable dates unchanged")
        void shouldLeaveUnparseableDates() {
            assertEquals("next tuesday", FieldValueCoercer.coerce("next tuesday", ProcFlowFieldType.DATE));
        }
    }

    // ========================================================================
    // OTHER TYPES
    // ========================================================================

    @Nested
    @DisplayName("Other Types")
    class OtherTypeTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({"yes,true", "Y,true", "1,true", "no,false", "FALSE,false", "0,false"})
        @DisplayName("Should read boolean words")
        void shouldReadBooleanWords(String raw, boolean expected) {
            assertEquals(expected, FieldValueCoercer.coerce(raw, ProcFlowFieldType.BOOLEAN));
        }

        @Test
        @DisplayName("Should leave unknown boolean words unchanged")
        void shouldLeaveUnknownBooleanWords() {
            assertEquals("maybe", FieldValueCoercer.coerce("maybe", ProcFlowFieldType.BOOLEAN));
        }

        @Test
        @DisplayName("Should parse JSON list text")
        void shouldParseJsonList() {
            assertEquals(List.of("a", "b"), FieldValueCoercer.coerce("[\"a\", \"b\"]", ProcFlowFieldType.LIST));
        }

        @Test
        @DisplayName("Should split comma separated list text")
        void shouldSplitCommaSeparatedList() {
            assertEquals(List.of("alpha", "beta", "gamma"),
                    FieldValueCoercer.coerce("alpha, beta,,gamma", ProcFlowFieldType.LIST));
        }

        @Test
        @DisplayName("Should wrap a scalar into a list")
        void shouldWrapScalar() {
            assertEquals(List.of(7), FieldValueCoercer.coerce(7, ProcFlowFieldType.LIST));
        }

        @Test
        @DisplayName("Should trim text")
        void shouldTrimText() {
            assertEquals("Acme Corp", FieldValueCoercer.coerce("  Acme Corp ", ProcFlowFieldType.TEXT));
        }

        @Test
        @DisplayName("Should turn a file map into a file reference")
        void shouldReadFileMap() {
            Object coerced = FieldValueCoercer.coerce(
                    Map.of("id", "f-1", "name", "scan.png", "size", 12, "contentType", "image/png"),
                    ProcFlowFieldType.FILE);

            assertEquals(new FileReference("f-1", "scan.png", 12L, "image/png"), coerced);
        }

        @Test
        @DisplayName("Should pass null through")
        void shouldPassNullThrough() {
            assertNull(FieldValueCoercer.coerce(null, ProcFlowFieldType.NUMBER));
        }
    }
}
