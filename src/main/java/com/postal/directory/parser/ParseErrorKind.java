package com.postal.directory.parser;

/**
 * Classifies a {@link ParseException}.
 */
public enum ParseErrorKind {
    /** Source bytes could not be decoded. */
    ENCODING,
    /** A line split into the wrong number of fields. */
    FIELD_COUNT,
    /** A required field was blank. */
    EMPTY_FIELD,
    /** A numeric field did not hold an integer. */
    INVALID_NUMBER,
    /** A field broke its domain grammar (identifier, state code, enumeration code). */
    INVALID_VALUE,
    /** Any other parser failure. */
    PARSE_FAILED
}
