package com.postal.directory.core.model;

/**
 * Identifier of an operational unit (UOP_NU).
 */
public final class OperationalUnitId extends NumericId<OperationalUnitId> {

    private static final String LABEL = "operational unit";

    private OperationalUnitId(int value) {
        super(value);
    }

    public static OperationalUnitId of(long value) {
        return new OperationalUnitId(checkValue(value, LABEL));
    }

    public static OperationalUnitId parse(String text) {
        return new OperationalUnitId(parseValue(text, LABEL));
    }
}
