package com.postal.directory.core.model;

/**
 * Type of locality (LOC_IN_TIPO_LOC).
 */
public enum LocalityType implements CodedValue {
    DISTRICT("D"),
    MUNICIPALITY("M"),
    VILLAGE("P");

    private final String code;

    LocalityType(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    public static LocalityType fromCode(String text) {
        return CodedValue.fromCode(LocalityType.class, text, "locality type");
    }
}
