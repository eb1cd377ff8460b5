package com.postal.directory.core.model;

/**
 * Identifier of a neighborhood (BAI_NU).
 */
public final class NeighborhoodId extends NumericId<NeighborhoodId> {

    private static final String LABEL = "neighborhood";

    private NeighborhoodId(int value) {
        super(value);
    }

    public static NeighborhoodId of(long value) {
        return new NeighborhoodId(checkValue(value, LABEL));
    }

    public static NeighborhoodId parse(String text) {
        return new NeighborhoodId(parseValue(text, LABEL));
    }
}
