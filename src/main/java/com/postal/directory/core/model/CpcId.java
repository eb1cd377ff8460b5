package com.postal.directory.core.model;

/**
 * Identifier of a community postal box (CPC_NU).
 */
public final class CpcId extends NumericId<CpcId> {

    private static final String LABEL = "CPC";

    private CpcId(int value) {
        super(value);
    }

    public static CpcId of(long value) {
        return new CpcId(checkValue(value, LABEL));
    }

    public static CpcId parse(String text) {
        return new CpcId(parseValue(text, LABEL));
    }
}
