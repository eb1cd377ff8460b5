package com.postal.directory.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A post office, franchise or distribution center (LOG_UNID_OPER).
 *
 * @param id                operational unit identifier (UOP_NU)
 * @param state             federative unit (UFE_SG)
 * @param localityId        locality (LOC_NU)
 * @param neighborhoodId    neighborhood (BAI_NU)
 * @param streetId          street (LOG_NU); absent in uncoded localities
 * @param name              unit name (UOP_NO)
 * @param address           address text (UOP_ENDERECO)
 * @param postalCode        postal code (CEP)
 * @param postBoxIndicator  whether the unit offers post boxes (UOP_IN_CP)
 * @param abbreviatedName   abbreviated name (UOP_NO_ABREV)
 */
public record OperationalUnit(
        OperationalUnitId id,
        StateCode state,
        LocalityId localityId,
        NeighborhoodId neighborhoodId,
        Optional<AddressId> streetId,
        String name,
        String address,
        String postalCode,
        PostBoxIndicator postBoxIndicator,
        Optional<String> abbreviatedName
) {
    public OperationalUnit {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(localityId, "localityId is required");
        Objects.requireNonNull(neighborhoodId, "neighborhoodId is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(address, "address is required");
        Objects.requireNonNull(postalCode, "postalCode is required");
        Objects.requireNonNull(postBoxIndicator, "postBoxIndicator is required");
        streetId = streetId != null ? streetId : Optional.empty();
        abbreviatedName = abbreviatedName != null ? abbreviatedName : Optional.empty();
    }
}
