package com.postal.directory.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A municipality, district or village (LOG_LOCALIDADE).
 *
 * @param id               locality identifier (LOC_NU)
 * @param state            federative unit (UFE_SG)
 * @param name             locality name (LOC_NO)
 * @param postalCode       general postal code (CEP); only meaningful when
 *                         {@code situation} is {@link LocalitySituation#NOT_CODED}
 * @param situation        coding level (LOC_IN_SIT)
 * @param type             locality type (LOC_IN_TIPO_LOC)
 * @param parentId         locality this one is subordinate to (LOC_NU_SUB)
 * @param abbreviatedName  abbreviated name (LOC_NO_ABREV)
 * @param municipalityCode IBGE municipality code (MUN_NU)
 */
public record Locality(
        LocalityId id,
        StateCode state,
        String name,
        Optional<String> postalCode,
        LocalitySituation situation,
        LocalityType type,
        Optional<LocalityId> parentId,
        Optional<String> abbreviatedName,
        Optional<String> municipalityCode
) {
    public Locality {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(situation, "situation is required");
        Objects.requireNonNull(type, "type is required");
        postalCode = postalCode != null ? postalCode : Optional.empty();
        parentId = parentId != null ? parentId : Optional.empty();
        abbreviatedName = abbreviatedName != null ? abbreviatedName : Optional.empty();
        municipalityCode = municipalityCode != null ? municipalityCode : Optional.empty();
    }

    public boolean isSubordinate() {
        return parentId.isPresent();
    }
}
