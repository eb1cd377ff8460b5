package com.postal.directory.core.model;

/**
 * An enumeration constant stored in the eDNE files as a short code.
 */
public interface CodedValue {

    /**
     * Returns the code as it appears in the source files.
     */
    String code();

    /**
     * Finds the constant of {@code type} whose code matches {@code text}.
     * Text is stripped first; ASCII letters are upper-cased before matching.
     *
     * @throws InvalidCodeException if no constant matches
     */
    static <E extends Enum<E> & CodedValue> E fromCode(Class<E> type, String text, String domain) {
        String code = SourceText.toAsciiUpperCase(SourceText.strip(text));
        for (E constant : type.getEnumConstants()) {
            if (constant.code().equals(code)) {
                return constant;
            }
        }
        throw new InvalidCodeException(domain, code);
    }
}
