package br.edu.ifba.ontology.storage;

import br.edu.ifba.ontology.core.EdgeType;
import br.edu.ifba.ontology.core.Entity;
import br.edu.ifba.ontology.core.Relationship;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Storage contract for the ontology graph.
 *
 * <p>Every operation is asynchronous. Failures complete the returned future
 * exceptionally with a {@link StorageException}: {@link TransientStorageException}
 * for network/timeout style problems that may succeed on a later attempt,
 * {@link PermanentStorageException} for problems that will not (schema violation,
 * corrupt data). Absence is never a failure: a missing entity is an empty
 * {@link Optional}, an entity without edges an empty list.</p>
 *
 * <p>Writes are idempotent upserts keyed by entity id and by
 * {@link Relationship#key()}, so batches may be replayed and applied in any order.</p>
 *
 * Implementations: InMemoryGraphStorage, GuardedGraphStorage (decorator)
 */
public interface GraphStoragePort extends AutoCloseable {

    /**
     * Initializes the storage backend.
     * Must be called before any other operations.
     */
    CompletableFuture<Void> initialize();

    // ===== Reads =====

    /**
     * Looks up one entity.
     *
     * @param id the entity id
     * @return the entity, or empty when it does not exist
     */
    CompletableFuture<Optional<Entity>> getEntity(@NotNull String id);

    /**
     * Lists the outgoing edges of an entity.
     *
     * @param headId the head entity id
     * @param edgeType restricts the result to one edge type; {@code null} returns all types
     * @return outgoing edges, possibly empty
     */
    CompletableFuture<List<Relationship>> getRelationshipsByHead(@NotNull String headId, @Nullable EdgeType edgeType);

    // ===== Writes =====

    /**
     * Upserts a batch of entities. Re-ingesting an id merges metadata (newer wins).
     */
    CompletableFuture<Void> storeEntities(@NotNull List<Entity> batch);

    /**
     * Upserts a batch of relationships keyed by (head, tail, type).
     */
    CompletableFuture<Void> storeRelationships(@NotNull List<Relationship> batch);

    // ===== Health =====

    /**
     * Reports backend health. Never completes exceptionally: an unreachable backend is
     * {@link HealthStatus#DOWN}.
     */
    CompletableFuture<HealthStatus> healthCheck();

    /**
     * Releases backend resources.
     */
    @Override
    void close();
}
