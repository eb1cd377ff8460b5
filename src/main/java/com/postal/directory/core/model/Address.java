package com.postal.directory.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A street, avenue or similar in a coded locality (LOG_LOGRADOURO_XX).
 *
 * <p>A street may cross two neighborhoods; {@code startNeighborhoodId} is the
 * one used to label its postal code.</p>
 *
 * @param id                  street identifier (LOG_NU)
 * @param state               federative unit (UFE_SG)
 * @param localityId          owning locality (LOC_NU)
 * @param startNeighborhoodId first neighborhood (BAI_NU_INI)
 * @param endNeighborhoodId   last neighborhood (BAI_NU_FIM)
 * @param name                street name (LOG_NO)
 * @param complement          complement (LOG_COMPLEMENTO)
 * @param postalCode          postal code (CEP)
 * @param streetType          type label such as "Rua" or "Avenida" (TLO_TX)
 * @param streetTypeIndicator whether the type label prefixes the name (LOG_STA_TLO)
 * @param abbreviatedName     abbreviated name (LOG_NO_ABREV)
 */
public record Address(
        AddressId id,
        StateCode state,
        LocalityId localityId,
        NeighborhoodId startNeighborhoodId,
        Optional<NeighborhoodId> endNeighborhoodId,
        String name,
        Optional<String> complement,
        String postalCode,
        String streetType,
        Optional<StreetTypeIndicator> streetTypeIndicator,
        Optional<String> abbreviatedName
) {
    public Address {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(localityId, "localityId is required");
        Objects.requireNonNull(startNeighborhoodId, "startNeighborhoodId is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(postalCode, "postalCode is required");
        Objects.requireNonNull(streetType, "streetType is required");
        endNeighborhoodId = endNeighborhoodId != null ? endNeighborhoodId : Optional.empty();
        complement = complement != null ? complement : Optional.empty();
        streetTypeIndicator = streetTypeIndicator != null ? streetTypeIndicator : Optional.empty();
        abbreviatedName = abbreviatedName != null ? abbreviatedName : Optional.empty();
    }

    /**
     * Returns the name as displayed: prefixed by the type label when the
     * indicator says so, otherwise the bare name.
     */
    public String displayName() {
        if (streetTypeIndicator.map(StreetTypeIndicator::isAffirmative).orElse(false)) {
            return streetType + " " + name;
        }
        return name;
    }
}
