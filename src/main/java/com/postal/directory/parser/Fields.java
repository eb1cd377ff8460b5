package com.postal.directory.parser;

import com.postal.directory.core.model.SourceText;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Extraction rules for single field values.
 *
 * <p>Blank checks look at the text stripped of whitespace as defined by
 * {@link SourceText}, but returned strings are the field content untouched.
 * Numbers are an optional sign followed by ASCII digits.</p>
 */
public final class Fields {

    private Fields() {
    }

    public static String required(String field, String fieldName, long lineNumber) {
        if (SourceText.isBlank(field)) {
            throw ParseException.emptyField(fieldName, lineNumber);
        }
        return field;
    }

    public static Optional<String> optional(String field) {
        if (SourceText.isBlank(field)) {
            return Optional.empty();
        }
        return Optional.of(field);
    }

    public static long number(String field, String fieldName, long lineNumber) {
        String text = field == null ? "" : field;
        String stripped = SourceText.strip(text);
        String digits = stripped.startsWith("+") || stripped.startsWith("-") ? stripped.substring(1) : stripped;
        if (!SourceText.isAsciiDigits(digits)) {
            throw ParseException.invalidNumber(fieldName, text, lineNumber);
        }
        try {
            return Long.parseLong(stripped);
        } catch (NumberFormatException e) {
            throw ParseException.invalidNumber(fieldName, text, lineNumber);
        }
    }

    public static OptionalLong optionalNumber(String field, String fieldName, long lineNumber) {
        if (SourceText.isBlank(field)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(number(field, fieldName, lineNumber));
    }
}
