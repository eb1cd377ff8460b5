package com.postal.directory.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A named subdivision of a locality (LOG_BAIRRO).
 *
 * @param id              neighborhood identifier (BAI_NU)
 * @param state           federative unit (UFE_SG)
 * @param localityId      owning locality (LOC_NU)
 * @param name            neighborhood name (BAI_NO)
 * @param abbreviatedName abbreviated name (BAI_NO_ABREV)
 */
public record Neighborhood(
        NeighborhoodId id,
        StateCode state,
        LocalityId localityId,
        String name,
        Optional<String> abbreviatedName
) {
    public Neighborhood {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(localityId, "localityId is required");
        Objects.requireNonNull(name, "name is required");
        abbreviatedName = abbreviatedName != null ? abbreviatedName : Optional.empty();
    }
}
