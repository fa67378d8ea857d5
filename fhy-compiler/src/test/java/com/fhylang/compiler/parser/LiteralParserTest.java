package com.fhylang.compiler.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class LiteralParserTest {

    @Nested
    @DisplayName("Integers")
    class IntegerTests {

        @ParameterizedTest
        @CsvSource({"0, 0", "42, 42", "1_000_000, 1000000", "0b101, 5", "0B1_1, 3", "0o17, 15",
                "0O7, 7", "0xff, 255", "0XFF, 255", "0x7fff_ffff_ffff_ffff, 9223372036854775807"})
        void testValid(String text, long expected) {
            assertEquals(expected, LiteralParser.parseInt(text));
        }

        @Test
        @DisplayName("overflow is an error, not a wrapped value")
        void testOverflow() {
            assertThatThrownBy(() -> LiteralParser.parseInt("0x8000000000000000"))
                    .isInstanceOf(LiteralError.class)
                    .hasMessageContaining("out of range");
        }

        @Test
        @DisplayName("digit outside the base")
        void testInvalidDigit() {
            LiteralError error = assertThrows(LiteralError.class, () -> LiteralParser.parseInt("0b102"));
            assertThat(error.getMessage()).contains("'2'").contains("base 2");
            assertEquals("0b102", error.getLiteral());
            assertNull(error.getLocation());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "0x", "abc", "-1"})
        void testMalformed(String text) {
            assertThrows(LiteralError.class, () -> LiteralParser.parseInt(text));
        }
    }

    @Nested
    @DisplayName("Floats")
    class FloatTests {

        @ParameterizedTest
        @CsvSource({"1.0, 1.0", ".2, 0.2", "1., 1.0", "1e2, 100.0", "1.2e3, 1200.0", "2.5E-1, 0.25", "1_0.5, 10.5"})
        void testValid(String text, double expected) {
            assertEquals(expected, LiteralParser.parseFloat(text), 1e-12);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", ".", "e5", "1.2.3", "NaN", "Infinity", "0x1p3"})
        void testMalformed(String text) {
            assertThrows(LiteralError.class, () -> LiteralParser.parseFloat(text));
        }

        @Test
        @DisplayName("values beyond double range are rejected")
        void testOutOfRange() {
            assertThatThrownBy(() -> LiteralParser.parseFloat("1e400"))
                    .isInstanceOf(LiteralError.class)
                    .hasMessageContaining("out of range");
        }
    }

    @Nested
    @DisplayName("Complex")
    class ComplexTests {

        @ParameterizedTest
        @CsvSource({"1j, 1.0", "1.0J, 1.0", "1e10j, 1e10", ".2j, 0.2"})
        void testImaginary(String text, double expected) {
            assertEquals(expected, LiteralParser.parseImaginary(text), 1e-12);
        }

        @ParameterizedTest
        @ValueSource(strings = {"j", "1", "1.0k", "xj"})
        void testMalformed(String text) {
            assertThrows(LiteralError.class, () -> LiteralParser.parseImaginary(text));
        }
    }

    @Test
    @DisplayName("decode dispatches on the literal kind")
    void testDecode() {
        assertEquals(255L, LiteralParser.decode("0xff", LiteralParser.LiteralKind.INT));
        assertEquals(0.5, LiteralParser.decode(".5", LiteralParser.LiteralKind.FLOAT));
        assertEquals(3.0, LiteralParser.decode("3j", LiteralParser.LiteralKind.COMPLEX));
    }
}
