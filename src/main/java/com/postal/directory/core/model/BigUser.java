package com.postal.directory.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A high-volume addressee with its own postal code (LOG_GRANDE_USUARIO).
 *
 * <p>In localities not coded at street level the street reference is absent
 * and {@code address} carries the full address text.</p>
 *
 * @param id              big user identifier (GRU_NU)
 * @param state           federative unit (UFE_SG)
 * @param localityId      locality (LOC_NU)
 * @param neighborhoodId  neighborhood (BAI_NU)
 * @param streetId        street (LOG_NU)
 * @param name            addressee name (GRU_NO)
 * @param address         address text (GRU_ENDERECO)
 * @param postalCode      postal code (CEP)
 * @param abbreviatedName abbreviated name (GRU_NO_ABREV)
 */
public record BigUser(
        BigUserId id,
        StateCode state,
        LocalityId localityId,
        NeighborhoodId neighborhoodId,
        Optional<AddressId> streetId,
        String name,
        String address,
        String postalCode,
        Optional<String> abbreviatedName
) {
    public BigUser {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(localityId, "localityId is required");
        Objects.requireNonNull(neighborhoodId, "neighborhoodId is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(address, "address is required");
        Objects.requireNonNull(postalCode, "postalCode is required");
        streetId = streetId != null ? streetId : Optional.empty();
        abbreviatedName = abbreviatedName != null ? abbreviatedName : Optional.empty();
    }
}
