package com.postal.directory.lookup;

/**
 * Which record kind supplied a lookup entry. Declared in merge order: a later
 * constant wins over an earlier one for the same postal code.
 */
public enum CepType {
    UNCODED_LOCALITY("Uncoded Locality (General CEP)"),
    STREET("Street/Address"),
    BIG_USER("Big User"),
    OPERATIONAL_UNIT("Operational Unit"),
    CPC("Community Postal Box (CPC)");

    private final String label;

    CepType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
