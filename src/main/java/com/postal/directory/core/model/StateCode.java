package com.postal.directory.core.model;

/**
 * Brazilian federative units (UFE_SG).
 *
 * <p>Declaration order is the order used when grouping or sorting by state.</p>
 */
public enum StateCode {
    AC("Acre"),
    AL("Alagoas"),
    AP("Amapá"),
    AM("Amazonas"),
    BA("Bahia"),
    CE("Ceará"),
    DF("Distrito Federal"),
    ES("Espírito Santo"),
    GO("Goiás"),
    MA("Maranhão"),
    MT("Mato Grosso"),
    MS("Mato Grosso do Sul"),
    MG("Minas Gerais"),
    PA("Pará"),
    PB("Paraíba"),
    PR("Paraná"),
    PE("Pernambuco"),
    PI("Piauí"),
    RJ("Rio de Janeiro"),
    RN("Rio Grande do Norte"),
    RS("Rio Grande do Sul"),
    RO("Rondônia"),
    RR("Roraima"),
    SC("Santa Catarina"),
    SP("São Paulo"),
    SE("Sergipe"),
    TO("Tocantins");

    private final String fullName;

    StateCode(String fullName) {
        this.fullName = fullName;
    }

    public String fullName() {
        return fullName;
    }

    /**
     * Parses a two-letter abbreviation, ignoring case and surrounding whitespace.
     *
     * @throws InvalidStateCodeException if the input is empty, not two
     *                                   characters long, or not a known unit
     */
    public static StateCode parse(String text) {
        String trimmed = SourceText.strip(text);
        if (trimmed.isEmpty()) {
            throw InvalidStateCodeException.empty();
        }
        if (trimmed.length() != 2) {
            throw InvalidStateCodeException.wrongLength(trimmed);
        }
        String code = SourceText.toAsciiUpperCase(trimmed);
        for (StateCode state : values()) {
            if (state.name().equals(code)) {
                return state;
            }
        }
        throw InvalidStateCodeException.unknownCode(code);
    }
}
