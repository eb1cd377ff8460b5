package com.postal.directory.core.model;

/**
 * Thrown when text does not match any code of a closed eDNE enumeration.
 */
public class InvalidCodeException extends InvalidValueException {

    private final String domain;
    private final String code;

    public InvalidCodeException(String domain, String code) {
        super("invalid " + domain + " code: '" + code + "'");
        this.domain = domain;
        this.code = code;
    }

    public String getDomain() {
        return domain;
    }

    /**
     * Returns the rejected code after trimming and case folding.
     */
    public String getCode() {
        return code;
    }
}
