package com.postal.directory.parser;

import com.postal.directory.core.model.LocalityId;
import com.postal.directory.core.model.StateCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Field extraction Tests")
class FieldsTest {

    @Nested
    @DisplayName("Fields")
    class StaticRules {

        @Test
        @DisplayName("Required fields come back untrimmed")
        void requiredKeepsWhitespace() {
            assertEquals("  Centro ", Fields.required("  Centro ", "BAI_NO", 1));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "\t"})
        void requiredRejectsBlank(String field) {
            ParseException e = assertThrows(ParseException.class, () -> Fields.required(field, "LOC_NO", 7));
            assertEquals(ParseErrorKind.EMPTY_FIELD, e.getKind());
            assertEquals("LOC_NO", e.getFieldName());
            assertEquals("line 7: field 'LOC_NO' is empty", e.getMessage());
        }

        @ParameterizedTest
        @ValueSource(strings = {"\u00A0", " \u00A0 ", "\u0085", "\u2007"})
        @DisplayName("No-break spaces and NEL count as whitespace")
        void latin1SpacesAreBlank(String field) {
            ParseException e = assertThrows(ParseException.class, () -> Fields.required(field, "CEP", 2));
            assertEquals(ParseErrorKind.EMPTY_FIELD, e.getKind());
            assertEquals(Optional.empty(), Fields.optional(field));
            assertEquals(OptionalLong.empty(), Fields.optionalNumber(field, "MUN_NU", 2));
        }

        @Test
        void optionalMapsBlankToEmpty() {
            assertEquals(Optional.empty(), Fields.optional(""));
            assertEquals(Optional.empty(), Fields.optional("   "));
            assertEquals(Optional.of(" x "), Fields.optional(" x "));
        }

        @Test
        void numberTrims() {
            assertEquals(123, Fields.number(" 123 ", "N", 1));
        }

        @Test
        void numberStripsNoBreakSpaceAndAcceptsSign() {
            assertEquals(42, Fields.number("\u00A042\u00A0", "N", 1));
            assertEquals(-7, Fields.number("-7", "N", 1));
            assertEquals(7, Fields.number("+7", "N", 1));
        }

        @ParameterizedTest
        @ValueSource(strings = {"\uFF14\uFF12", "\u0664\u0662", "+", "-", "1 2"})
        @DisplayName("Only ASCII digits form a number")
        void numberRejectsNonAsciiDigits(String field) {
            ParseException e = assertThrows(ParseException.class, () -> Fields.number(field, "N", 1));
            assertEquals(ParseErrorKind.INVALID_NUMBER, e.getKind());
        }

        @Test
        void numberRejectsText() {
            ParseException e = assertThrows(ParseException.class, () -> Fields.number("12x", "MUN_NU", 3));
            assertEquals(ParseErrorKind.INVALID_NUMBER, e.getKind());
            assertEquals("12x", e.getValue());
            assertEquals(3, e.getLineNumber());
        }

        @Test
        void optionalNumber() {
            assertEquals(OptionalLong.empty(), Fields.optionalNumber(" ", "N", 1));
            assertEquals(OptionalLong.of(5), Fields.optionalNumber("5", "N", 1));
            assertThrows(ParseException.class, () -> Fields.optionalNumber("five", "N", 1));
        }
    }

    @Nested
    @DisplayName("RecordFields")
    class Record {

        private final RecordFields fields = new RecordFields(List.of("0", "SP", "", "xx", "12"), 9);

        @Test
        @DisplayName("Domain parser failures become INVALID_VALUE with the field name")
        void invalidValue() {
            ParseException e = assertThrows(ParseException.class,
                    () -> fields.required(0, "LOC_NU", LocalityId::parse));

            assertEquals(ParseErrorKind.INVALID_VALUE, e.getKind());
            assertEquals("LOC_NU", e.getFieldName());
            assertEquals("0", e.getValue());
            assertEquals("locality ID cannot be zero", e.getReason());
            assertEquals(9, e.getLineNumber());
        }

        @Test
        void requiredBlankIsEmptyFieldBeforeParsing() {
            ParseException e = assertThrows(ParseException.class,
                    () -> fields.required(2, "LOC_NU_SUB", LocalityId::parse));
            assertEquals(ParseErrorKind.EMPTY_FIELD, e.getKind());
        }

        @Test
        void optionalParsedValues() {
            assertEquals(Optional.empty(), fields.optional(2, "LOC_NU_SUB", LocalityId::parse));
            assertEquals(Optional.of(StateCode.SP), fields.optional(1, "UFE_SG", StateCode::parse));
            assertThrows(ParseException.class, () -> fields.optional(3, "UFE_SG", StateCode::parse));
        }

        @Test
        void numbers() {
            assertEquals(12, fields.requiredNumber(4, "MUN_NU"));
            assertTrue(fields.optionalNumber(2, "MUN_NU").isEmpty());
        }

        @Test
        void accessors() {
            assertEquals(5, fields.size());
            assertEquals("xx", fields.raw(3));
            assertEquals(9, fields.lineNumber());
        }
    }
}
