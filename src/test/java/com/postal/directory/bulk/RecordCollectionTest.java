package com.postal.directory.bulk;

import com.postal.directory.core.model.LocalityId;
import com.postal.directory.core.model.Neighborhood;
import com.postal.directory.core.model.NeighborhoodId;
import com.postal.directory.core.model.StateCode;
import com.postal.directory.parser.RecordKinds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RecordCollection Tests")
class RecordCollectionTest {

    private RecordCollection<NeighborhoodId, Neighborhood> collection;

    @BeforeEach
    void setUp() {
        collection = new RecordCollection<>(RecordKinds.NEIGHBORHOOD);
    }

    private static Neighborhood neighborhood(long id, String name) {
        return new Neighborhood(NeighborhoodId.of(id), StateCode.AC, LocalityId.of(16), name, Optional.empty());
    }

    @Test
    void emptyOnCreation() {
        assertTrue(collection.isEmpty());
        assertEquals(0, collection.size());
        assertEquals(RecordKinds.NEIGHBORHOOD, collection.kind());
    }

    @Test
    @DisplayName("Insert returns the replaced record and keeps the last one")
    void insertReplaces() {
        assertEquals(Optional.empty(), collection.insert(neighborhood(1, "Centro")));

        Optional<Neighborhood> replaced = collection.insert(neighborhood(1, "Centro Novo"));

        assertEquals("Centro", replaced.orElseThrow().name());
        assertEquals(1, collection.size());
        assertEquals("Centro Novo", collection.get(NeighborhoodId.of(1)).orElseThrow().name());
    }

    @Test
    void getAndContains() {
        collection.insert(neighborhood(5, "Bosque"));

        assertTrue(collection.contains(NeighborhoodId.of(5)));
        assertFalse(collection.contains(NeighborhoodId.of(6)));
        assertTrue(collection.get(NeighborhoodId.of(6)).isEmpty());
    }

    @Test
    @DisplayName("Iteration follows first insertion order")
    void iterationOrder() {
        collection.insert(neighborhood(3, "C"));
        collection.insert(neighborhood(1, "A"));
        collection.insert(neighborhood(3, "C2"));

        List<String> names = collection.stream().map(Neighborhood::name).collect(Collectors.toList());

        assertEquals(List.of("C2", "A"), names);
        assertEquals(List.of(NeighborhoodId.of(3), NeighborhoodId.of(1)), List.copyOf(collection.ids()));
    }

    @Test
    void valuesAreReadOnly() {
        collection.insert(neighborhood(1, "A"));

        assertThrows(UnsupportedOperationException.class, () -> collection.values().clear());
    }

    @Test
    void equality() {
        RecordCollection<NeighborhoodId, Neighborhood> other = new RecordCollection<>(RecordKinds.NEIGHBORHOOD);
        collection.insert(neighborhood(1, "A"));
        other.insert(neighborhood(1, "A"));

        assertEquals(collection, other);
        assertEquals(collection.hashCode(), other.hashCode());
    }
}
