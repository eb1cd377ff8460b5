package com.postal.directory.core.model;

/**
 * Whether an operational unit offers post boxes (UOP_IN_CP).
 */
public enum PostBoxIndicator implements CodedValue {
    YES("S"),
    NO("N");

    private final String code;

    PostBoxIndicator(String code) {
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    public boolean isAffirmative() {
        return this == YES;
    }

    public static PostBoxIndicator fromCode(String text) {
        return CodedValue.fromCode(PostBoxIndicator.class, text, "post box indicator");
    }
}
