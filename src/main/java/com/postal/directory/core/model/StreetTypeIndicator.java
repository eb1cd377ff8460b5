package com.postal.directory.core.model;

/**
 * Whether a street's type label is shown in front of its name (LOG_STA_TLO).
 */
public enum StreetTypeIndicator implements CodedValue {
    YES("S"),
    NO("N");

    private final String code;

    StreetTypeIndicator(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    public boolean isAffirmative() {
        return this == YES;
    }

    public static StreetTypeIndicator fromCode(String text) {
        return CodedValue.fromCode(StreetTypeIndicator.class, text, "street type indicator");
    }
}
