package com.postal.directory.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FieldSplitter Tests")
class FieldSplitterTest {

    @Test
    @DisplayName("Empty and trailing fields are preserved")
    void keepsEmptyFields() {
        assertEquals(List.of("a", "", "b", ""), FieldSplitter.split("a@@b@", '@'));
    }

    @Test
    void lineWithoutSeparatorIsOneField() {
        assertEquals(List.of("abc"), FieldSplitter.split("abc", '@'));
        assertEquals(List.of(""), FieldSplitter.split("", '@'));
    }

    @Test
    void onlySeparators() {
        assertEquals(List.of("", "", ""), FieldSplitter.split("@@", '@'));
    }

    @Test
    void customSeparator() {
        assertEquals(List.of("1", "SP", "São Paulo"), FieldSplitter.split("1|SP|São Paulo", '|'));
    }

    @Test
    @DisplayName("splitChecked reports expected and actual counts with the line number")
    void splitCheckedMismatch() {
        ParseException e = assertThrows(ParseException.class,
                () -> FieldSplitter.splitChecked("1@2@3", '@', 5, 42));

        assertEquals(ParseErrorKind.FIELD_COUNT, e.getKind());
        assertEquals(5, e.getExpectedFields());
        assertEquals(3, e.getActualFields());
        assertEquals(42, e.getLineNumber());
        assertEquals("line 42: expected 5 fields, got 3", e.getMessage());
    }

    @Test
    void splitCheckedMatch() {
        assertEquals(3, FieldSplitter.splitChecked("1@@3", '@', 3, 1).size());
    }
}
