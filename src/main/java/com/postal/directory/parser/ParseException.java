package com.postal.directory.parser;

/**
 * Runtime exception raised when an eDNE source line cannot be turned into a
 * record.
 *
 * <p>Every instance carries the 1-based source line number and, where it
 * applies, the field name and raw value, so the message can be shown to an
 * operator as is.</p>
 */
public class ParseException extends RuntimeException {

    private final ParseErrorKind kind;
    private final long lineNumber;
    private final String fieldName;
    private final String value;
    private final String reason;
    private final int expectedFields;
    private final int actualFields;

    private ParseException(ParseErrorKind kind, long lineNumber, String fieldName, String value,
                           String reason, int expectedFields, int actualFields, String message) {
        super(message);
        this.kind = kind;
        this.lineNumber = lineNumber;
        this.fieldName = fieldName;
        this.value = value;
        this.reason = reason;
        this.expectedFields = expectedFields;
        this.actualFields = actualFields;
    }

    public static ParseException encoding(String message) {
        return new ParseException(ParseErrorKind.ENCODING, 0, null, null, message, -1, -1,
                "encoding error: " + message);
    }

    public static ParseException fieldCount(int expected, int actual, long lineNumber) {
        return new ParseException(ParseErrorKind.FIELD_COUNT, lineNumber, null, null, null, expected, actual,
                "line " + lineNumber + ": expected " + expected + " fields, got " + actual);
    }

    public static ParseException emptyField(String fieldName, long lineNumber) {
        return new ParseException(ParseErrorKind.EMPTY_FIELD, lineNumber, fieldName, null, null, -1, -1,
                "line " + lineNumber + ": field '" + fieldName + "' is empty");
    }

    public static ParseException invalidNumber(String fieldName, String value, long lineNumber) {
        return new ParseException(ParseErrorKind.INVALID_NUMBER, lineNumber, fieldName, value, null, -1, -1,
                "line " + lineNumber + ": field '" + fieldName + "' has invalid number: '" + value + "'");
    }

    public static ParseException invalidValue(String fieldName, String value, String reason, long lineNumber) {
        return new ParseException(ParseErrorKind.INVALID_VALUE, lineNumber, fieldName, value, reason, -1, -1,
                "line " + lineNumber + ": field '" + fieldName + "' has invalid value '" + value + "': " + reason);
    }

    public static ParseException parseFailed(String message, long lineNumber) {
        return new ParseException(ParseErrorKind.PARSE_FAILED, lineNumber, null, null, message, -1, -1,
                "line " + lineNumber + ": " + message);
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the 1-based source line, or 0 when the failure is not tied to a line.
     */
    public long getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns the eDNE field name (e.g. {@code "LOC_NU"}), or null.
     */
    public String getFieldName() {
        return fieldName;
    }

    /**
     * Returns the rejected raw field text, or null.
     */
    public String getValue() {
        return value;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Returns the field count the record kind requires, or -1.
     */
    public int getExpectedFields() {
        return expectedFields;
    }

    /**
     * Returns the field count found on the line, or -1.
     */
    public int getActualFields() {
        return actualFields;
    }
}
