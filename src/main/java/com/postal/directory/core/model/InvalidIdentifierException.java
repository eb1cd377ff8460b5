package com.postal.directory.core.model;

/**
 * Thrown when a numeric identifier is zero or its text is not an unsigned
 * 32-bit decimal.
 */
public class InvalidIdentifierException extends InvalidValueException {

    public enum Reason {
        ZERO,
        INVALID_FORMAT
    }

    private final Reason reason;
    private final String label;
    private final String input;

    private InvalidIdentifierException(Reason reason, String label, String input, String message) {
        super(message);
        this.reason = reason;
        this.label = label;
        this.input = input;
    }

    static InvalidIdentifierException zero(String label) {
        return new InvalidIdentifierException(Reason.ZERO, label, "0", label + " ID cannot be zero");
    }

    static InvalidIdentifierException invalidFormat(String label, String input) {
        return new InvalidIdentifierException(Reason.INVALID_FORMAT, label, input,
                "invalid " + label + " ID format: '" + input + "'");
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the identifier kind, e.g. {@code "locality"}.
     */
    public String getLabel() {
        return label;
    }

    public String getInput() {
        return input;
    }
}
