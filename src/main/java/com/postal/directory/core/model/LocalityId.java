package com.postal.directory.core.model;

/**
 * Identifier of a locality (LOC_NU).
 */
public final class LocalityId extends NumericId<LocalityId> {

    private static final String LABEL = "locality";

    private LocalityId(int value) {
        super(value);
    }

    public static LocalityId of(long value) {
        return new LocalityId(checkValue(value, LABEL));
    }

    public static LocalityId parse(String text) {
        return new LocalityId(parseValue(text, LABEL));
    }
}
