package com.postal.directory.parser;

/**
 * Describes one eDNE record layout: its name, exact field count, how fields
 * map to a record, and which identifier keys the record.
 *
 * <p>Implementations are stateless, so one instance can parse any number of
 * sources, from any thread.</p>
 *
 * @param <I> identifier type
 * @param <R> record type
 */
public interface RecordKind<I, R> {

    /**
     * Short lower-case name used in logs and metrics, e.g. {@code "locality"}.
     */
    String name();

    int fieldCount();

    I idOf(R record);

    /**
     * Maps already split fields to a record. The field count has been checked.
     */
    R map(RecordFields fields);

    /**
     * Parses one line using the standard {@code @} separator.
     *
     * @throws ParseException if the line is malformed
     */
    default R parseLine(String line, long lineNumber) {
        return parseLine(line, lineNumber, FieldSplitter.DEFAULT_SEPARATOR);
    }

    default R parseLine(String line, long lineNumber, char separator) {
        return map(new RecordFields(
                FieldSplitter.splitChecked(line, separator, fieldCount(), lineNumber), lineNumber));
    }
}
