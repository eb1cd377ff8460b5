package com.postal.directory.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits eDNE lines on the field separator.
 *
 * <p>Empty fields are kept, including the one after a trailing separator:
 * {@code "a@@b@"} yields {@code ["a", "", "b", ""]}.</p>
 */
public final class FieldSplitter {

    public static final char DEFAULT_SEPARATOR = '@';

    private FieldSplitter() {
    }

    public static List<String> split(String line, char separator) {
        List<String> fields = new ArrayList<>();
        int start = 0;
        int index;
        while ((index = line.indexOf(separator, start)) >= 0) {
            fields.add(line.substring(start, index));
            start = index + 1;
        }
        fields.add(line.substring(start));
        return fields;
    }

    /**
     * Splits and checks the field count.
     *
     * @throws ParseException of kind {@link ParseErrorKind#FIELD_COUNT} when
     *                        the line does not have exactly {@code expected} fields
     */
    public static List<String> splitChecked(String line, char separator, int expected, long lineNumber) {
        List<String> fields = split(line, separator);
        if (fields.size() != expected) {
            throw ParseException.fieldCount(expected, fields.size(), lineNumber);
        }
        return fields;
    }
}
