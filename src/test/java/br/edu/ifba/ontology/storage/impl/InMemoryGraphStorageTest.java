package br.edu.ifba.ontology.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import br.edu.ifba.ontology.core.EdgeType;
import br.edu.ifba.ontology.storage.GraphStoragePort;
import br.edu.ifba.ontology.storage.HealthStatus;
import br.edu.ifba.ontology.storage.PermanentStorageException;

/**
 * Runs the storage contract against {@link InMemoryGraphStorage}.
 */
class InMemoryGraphStorageTest extends GraphStorageContractTest {

    @Override
    protected GraphStoragePort createStorage() {
        return new InMemoryGraphStorage(Runnable::run);
    }

    @Test
    @DisplayName("counts distinct entities and relationship keys")
    void testCounts() {
        InMemoryGraphStorage memory = (InMemoryGraphStorage) storage;
        memory.storeEntities(List.of(entity("dog", null), entity("cat", null), entity("dog", null))).join();
        memory.storeRelationships(List.of(
            edge("dog", "animal", EdgeType.SUBCLASS_OF, 0.9),
            edge("dog", "animal", EdgeType.SUBCLASS_OF, 0.7),
            edge("dog", "animal", EdgeType.HAS_ATTRIBUTE, 0.7))).join();

        assertEquals(2, memory.entityCount());
        assertEquals(2, memory.relationshipCount());
    }

    @Test
    @DisplayName("calls before initialize fail permanently")
    void testUninitialized() {
        InMemoryGraphStorage fresh = new InMemoryGraphStorage(Runnable::run);

        CompletionException thrown = assertThrows(CompletionException.class,
            () -> fresh.getRelationshipsByHead("dog", null).join());
        assertInstanceOf(PermanentStorageException.class, thrown.getCause());
        assertEquals(HealthStatus.DOWN, fresh.healthCheck().join());
    }

    @Test
    @DisplayName("close drops all data and reports DOWN")
    void testClose() {
        storage.storeEntities(List.of(entity("dog", null))).join();
        storage.close();

        assertEquals(HealthStatus.DOWN, storage.healthCheck().join());
        storage.initialize().join();
        assertEquals(0, ((InMemoryGraphStorage) storage).entityCount());
    }
}
