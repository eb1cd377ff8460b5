package com.postal.directory.core.model;

/**
 * Coding level of a locality (LOC_IN_SIT).
 */
public enum LocalitySituation implements CodedValue {
    /** Not coded at street level; the locality has its own postal code. */
    NOT_CODED("0"),
    /** Coded at street level. */
    CODED("1"),
    /** District or village inserted in street-level coding. */
    DISTRICT_OR_VILLAGE("2"),
    /** Street-level coding in progress. */
    CODING_IN_PROGRESS("3");

    private final String code;

    LocalitySituation(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    public static LocalitySituation fromCode(String text) {
        return CodedValue.fromCode(LocalitySituation.class, text, "locality situation");
    }
}
