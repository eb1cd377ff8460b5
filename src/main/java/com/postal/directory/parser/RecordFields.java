package com.postal.directory.parser;

import com.postal.directory.core.model.InvalidValueException;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;

/**
 * The split fields of one line together with its line number, so extraction
 * failures can name the exact line and field.
 */
public final class RecordFields {

    private final List<String> fields;
    private final long lineNumber;

    public RecordFields(List<String> fields, long lineNumber) {
        this.fields = List.copyOf(fields);
        this.lineNumber = lineNumber;
    }

    public long lineNumber() {
        return lineNumber;
    }

    public int size() {
        return fields.size();
    }

    public String raw(int index) {
        return fields.get(index);
    }

    public String required(int index, String fieldName) {
        return Fields.required(fields.get(index), fieldName, lineNumber);
    }

    public Optional<String> optional(int index) {
        return Fields.optional(fields.get(index));
    }

    /**
     * Reads a required field and converts it with a domain parser such as
     * {@code LocalityId::parse}.
     *
     * @throws ParseException {@link ParseErrorKind#EMPTY_FIELD} when blank,
     *                        {@link ParseErrorKind#INVALID_VALUE} when the parser rejects it
     */
    public <T> T required(int index, String fieldName, Function<String, T> parser) {
        return convert(required(index, fieldName), fieldName, parser);
    }

    /**
     * Reads an optional field; a non-blank value must satisfy the parser.
     */
    public <T> Optional<T> optional(int index, String fieldName, Function<String, T> parser) {
        return optional(index).map(value -> convert(value, fieldName, parser));
    }

    public long requiredNumber(int index, String fieldName) {
        return Fields.number(fields.get(index), fieldName, lineNumber);
    }

    public OptionalLong optionalNumber(int index, String fieldName) {
        return Fields.optionalNumber(fields.get(index), fieldName, lineNumber);
    }

    private <T> T convert(String value, String fieldName, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (InvalidValueException e) {
            throw ParseException.invalidValue(fieldName, value, e.getMessage(), lineNumber);
        }
    }
}
