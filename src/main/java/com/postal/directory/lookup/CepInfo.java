package com.postal.directory.lookup;

import com.postal.directory.core.model.StateCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Display-ready address summary for one postal code.
 *
 * @param postalCode   the postal code (CEP), carried as found in the source
 * @param state        federative unit
 * @param locality     locality name; empty when the locality was not loaded
 * @param neighborhood neighborhood name, or the parent locality's name for a
 *                     subordinate uncoded locality
 * @param address      street or address text; empty for locality-wide codes
 * @param complement   street complement, or the addressee name for big users,
 *                     operational units and CPCs
 * @param type         record kind that produced the entry
 */
public record CepInfo(
        String postalCode,
        StateCode state,
        String locality,
        Optional<String> neighborhood,
        String address,
        Optional<String> complement,
        CepType type
) {
    public CepInfo {
        Objects.requireNonNull(postalCode, "postalCode is required");
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(type, "type is required");
        locality = locality != null ? locality : "";
        address = address != null ? address : "";
        neighborhood = neighborhood != null ? neighborhood : Optional.empty();
        complement = complement != null ? complement : Optional.empty();
    }

    /**
     * Joins the non-empty parts into one line, e.g.
     * {@code "Rua Nelson Mesquita, Centro, Rio Branco/AC"}.
     */
    public String displayAddress() {
        List<String> parts = new ArrayList<>();
        if (!address.isEmpty()) {
            parts.add(address);
        }
        complement.ifPresent(parts::add);
        neighborhood.ifPresent(parts::add);
        parts.add(locality.isEmpty() ? state.name() : locality + "/" + state.name());
        return String.join(", ", parts);
    }
}
