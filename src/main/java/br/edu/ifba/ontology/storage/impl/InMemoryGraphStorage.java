package br.edu.ifba.ontology.storage.impl;

import br.edu.ifba.ontology.core.EdgeType;
import br.edu.ifba.ontology.core.Entity;
import br.edu.ifba.ontology.core.Relationship;
import br.edu.ifba.ontology.storage.GraphStoragePort;
import br.edu.ifba.ontology.storage.HealthStatus;
import br.edu.ifba.ontology.storage.PermanentStorageException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * In-memory graph storage backed by adjacency lists.
 * Thread-safe with ConcurrentHashMap backing; work runs on the supplied executor.
 *
 * <p>Relationships are upserted by (head, tail, type), so re-ingesting an edge replaces
 * its confidence. Entities are upserted by id with metadata merge.</p>
 */
public class InMemoryGraphStorage implements GraphStoragePort {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStorage.class);

    // Entity storage: id -> Entity
    private final ConcurrentHashMap<String, Entity> entities;

    // Adjacency list for outgoing edges: headId -> (key -> Relationship)
    private final ConcurrentHashMap<String, ConcurrentHashMap<Relationship.Key, Relationship>> outgoingEdges;

    private final Executor executor;

    private volatile boolean initialized = false;

    public InMemoryGraphStorage(@NotNull Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.entities = new ConcurrentHashMap<>();
        this.outgoingEdges = new ConcurrentHashMap<>();
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryGraphStorage initialized");
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Optional<Entity>> getEntity(@NotNull String id) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            return Optional.ofNullable(entities.get(id));
        }, executor);
    }

    @Override
    public CompletableFuture<List<Relationship>> getRelationshipsByHead(@NotNull String headId, @Nullable EdgeType edgeType) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            ConcurrentHashMap<Relationship.Key, Relationship> outgoing = outgoingEdges.get(headId);
            if (outgoing == null) {
                return List.of();
            }
            List<Relationship> result = new ArrayList<>();
            for (Relationship relationship : outgoing.values()) {
                if (edgeType == null || relationship.getEdgeType() == edgeType) {
                    result.add(relationship);
                }
            }
            result.sort(Comparator.comparing(Relationship::getTailEntity)
                .thenComparing(Relationship::getEdgeType));
            return result;
        }, executor);
    }

    @Override
    public CompletableFuture<Void> storeEntities(@NotNull List<Entity> batch) {
        return CompletableFuture.runAsync(() -> {
            ensureInitialized();
            for (Entity entity : batch) {
                entities.merge(entity.getId(), entity, Entity::mergeWith);
            }
            logger.debug("Upserted {} entities", batch.size());
        }, executor);
    }

    @Override
    public CompletableFuture<Void> storeRelationships(@NotNull List<Relationship> batch) {
        return CompletableFuture.runAsync(() -> {
            ensureInitialized();
            for (Relationship relationship : batch) {
                outgoingEdges.computeIfAbsent(relationship.getHeadEntity(), k -> new ConcurrentHashMap<>())
                    .put(relationship.key(), relationship);
            }
            logger.debug("Upserted {} relationships", batch.size());
        }, executor);
    }

    @Override
    public CompletableFuture<HealthStatus> healthCheck() {
        return CompletableFuture.completedFuture(initialized ? HealthStatus.HEALTHY : HealthStatus.DOWN);
    }

    /**
     * @return number of stored entities
     */
    public int entityCount() {
        return entities.size();
    }

    /**
     * @return number of stored relationships
     */
    public int relationshipCount() {
        return outgoingEdges.values().stream().mapToInt(ConcurrentHashMap::size).sum();
    }

    @Override
    public void close() {
        entities.clear();
        outgoingEdges.clear();
        initialized = false;
        logger.info("InMemoryGraphStorage closed");
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new PermanentStorageException("Storage not initialized. Call initialize() first.");
        }
    }
}
