package com.postal.directory.core.model;

/**
 * Identifier of a big user (GRU_NU).
 */
public final class BigUserId extends NumericId<BigUserId> {

    private static final String LABEL = "big user";

    private BigUserId(int value) {
        super(value);
    }

    public static BigUserId of(long value) {
        return new BigUserId(checkValue(value, LABEL));
    }

    public static BigUserId parse(String text) {
        return new BigUserId(parseValue(text, LABEL));
    }
}
