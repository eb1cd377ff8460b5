package com.postal.directory.core.model;

/**
 * Identifier of a street record (LOG_NU). Big users and operational units refer to streets with it too.
 */
public final class AddressId extends NumericId<AddressId> {

    private static final String LABEL = "address";

    private AddressId(int value) {
        super(value);
    }

    public static AddressId of(long value) {
        return new AddressId(checkValue(value, LABEL));
    }

    public static AddressId parse(String text) {
        return new AddressId(parseValue(text, LABEL));
    }
}
