package com.postal.directory.lookup;

import com.postal.directory.core.model.StateCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CepInfo Tests")
class CepInfoTest {

    @Test
    void displayAddressWithAllParts() {
        CepInfo info = new CepInfo("69900970", StateCode.AC, "Rio Branco", Optional.of("Base"),
                "Avenida Epaminondas Jácome, 2858", Optional.of("AC Rio Branco"), CepType.OPERATIONAL_UNIT);

        assertEquals("Avenida Epaminondas Jácome, 2858, AC Rio Branco, Base, Rio Branco/AC", info.displayAddress());
    }

    @Test
    @DisplayName("Empty parts are left out")
    void displayAddressSkipsEmptyParts() {
        CepInfo uncoded = new CepInfo("69928000", StateCode.AC, "Plácido de Castro", Optional.empty(),
                "", Optional.empty(), CepType.UNCODED_LOCALITY);
        CepInfo noLocality = new CepInfo("57100990", StateCode.AL, "", Optional.empty(),
                "Quadra 1", Optional.of("Conjunto Mutirão"), CepType.CPC);

        assertEquals("Plácido de Castro/AC", uncoded.displayAddress());
        assertEquals("Quadra 1, Conjunto Mutirão, AL", noLocality.displayAddress());
    }

    @Test
    void nullTextBecomesEmpty() {
        CepInfo info = new CepInfo("1", StateCode.SP, null, null, null, null, CepType.STREET);

        assertEquals("", info.locality());
        assertEquals("", info.address());
        assertEquals(Optional.empty(), info.neighborhood());
        assertEquals(Optional.empty(), info.complement());
    }

    @Test
    void requiredComponents() {
        assertThrows(NullPointerException.class,
                () -> new CepInfo(null, StateCode.SP, "", null, "", null, CepType.STREET));
        assertThrows(NullPointerException.class,
                () -> new CepInfo("1", StateCode.SP, "", null, "", null, null));
    }

    @ParameterizedTest
    @EnumSource(CepType.class)
    void everyTypeHasALabel(CepType type) {
        assertFalse(type.getLabel().isBlank());
    }

    @Test
    void labels() {
        assertEquals("Street/Address", CepType.STREET.getLabel());
        assertEquals("Community Postal Box (CPC)", CepType.CPC.getLabel());
    }
}
