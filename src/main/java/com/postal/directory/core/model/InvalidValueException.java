package com.postal.directory.core.model;

/**
 * Base type for values that do not satisfy an eDNE domain grammar
 * (identifiers, state codes, enumeration codes).
 */
public abstract class InvalidValueException extends IllegalArgumentException {

    protected InvalidValueException(String message) {
        super(message);
    }
}
