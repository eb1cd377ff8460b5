package com.postal.directory.core.model;

import java.util.Objects;

/**
 * Community postal box (LOG_CPC), serving areas without home delivery.
 *
 * @param id         CPC identifier (CPC_NU)
 * @param state      federative unit (UFE_SG)
 * @param localityId locality (LOC_NU)
 * @param name       CPC name (CPC_NO)
 * @param address    address text (CPC_ENDERECO)
 * @param postalCode postal code (CEP)
 */
public record Cpc(
        CpcId id,
        StateCode state,
        LocalityId localityId,
        String name,
        String address,
        String postalCode
) {
    public Cpc {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(localityId, "localityId is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(address, "address is required");
        Objects.requireNonNull(postalCode, "postalCode is required");
    }
}
