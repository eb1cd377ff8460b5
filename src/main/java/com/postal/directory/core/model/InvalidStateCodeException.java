package com.postal.directory.core.model;

/**
 * Thrown when a federative unit abbreviation (UFE_SG) cannot be parsed.
 */
public class InvalidStateCodeException extends InvalidValueException {

    public enum Reason {
        EMPTY,
        WRONG_LENGTH,
        UNKNOWN_CODE
    }

    private final Reason reason;
    private final String input;
    private final int length;

    private InvalidStateCodeException(Reason reason, String input, int length, String message) {
        super(message);
        this.reason = reason;
        this.input = input;
        this.length = length;
    }

    static InvalidStateCodeException empty() {
        return new InvalidStateCodeException(Reason.EMPTY, "", 0, "UF code is empty");
    }

    static InvalidStateCodeException wrongLength(String input) {
        return new InvalidStateCodeException(Reason.WRONG_LENGTH, input, input.length(),
                "UF code must have length 2, got " + input.length());
    }

    static InvalidStateCodeException unknownCode(String code) {
        return new InvalidStateCodeException(Reason.UNKNOWN_CODE, code, code.length(),
                "invalid UF code: " + code);
    }

    public Reason getReason() {
        return reason;
    }

    public String getInput() {
        return input;
    }

    /**
     * Returns the trimmed length of the rejected input.
     */
    public int getLength() {
        return length;
    }
}
