package br.edu.ifba.ontology.ingestion;

import br.edu.ifba.ontology.core.Entity;
import br.edu.ifba.ontology.core.Relationship;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Collects validated records of one worker until the batch is flushed.
 *
 * <p>Entities are deduplicated by id and relationships by (head, tail, edge type).
 * The last occurrence wins: a repeated relationship replaces the earlier one, a
 * repeated entity is merged into it so its metadata keys overwrite. Not thread-safe;
 * each worker owns one accumulator.</p>
 */
public class BatchAccumulator {

    /**
     * A drained batch, in first-seen order.
     */
    public record Batch(@NotNull List<Entity> entities, @NotNull List<Relationship> relationships) {
        public Batch {
            entities = List.copyOf(entities);
            relationships = List.copyOf(relationships);
        }

        public int size() {
            return entities.size() + relationships.size();
        }

        public boolean isEmpty() {
            return entities.isEmpty() && relationships.isEmpty();
        }
    }

    private final int batchSize;
    private final Duration flushInterval;

    private final LinkedHashMap<String, Entity> entities = new LinkedHashMap<>();
    private final LinkedHashMap<Relationship.Key, Relationship> relationships = new LinkedHashMap<>();
    private Instant openedAt;

    public BatchAccumulator(int batchSize, @NotNull Duration flushInterval) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        this.batchSize = batchSize;
        this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval must not be null");
    }

    public void add(@NotNull Entity entity, @NotNull Instant now) {
        markOpened(now);
        entities.merge(entity.getId(), entity, Entity::mergeWith);
    }

    public void add(@NotNull Relationship relationship, @NotNull Instant now) {
        markOpened(now);
        relationships.put(relationship.key(), relationship);
    }

    /**
     * @return number of distinct records currently held
     */
    public int size() {
        return entities.size() + relationships.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean isFull() {
        return size() >= batchSize;
    }

    /**
     * @return true when the batch holds records and its oldest one has waited for the flush interval
     */
    public boolean isDue(@NotNull Instant now) {
        return openedAt != null && !isEmpty() && !now.isBefore(openedAt.plus(flushInterval));
    }

    /**
     * @return time left before {@link #isDue} turns true, or the full interval when empty
     */
    @NotNull
    public Duration timeUntilDue(@NotNull Instant now) {
        if (openedAt == null) {
            return flushInterval;
        }
        Duration left = Duration.between(now, openedAt.plus(flushInterval));
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Empties the accumulator.
     */
    @NotNull
    public Batch drain() {
        Batch batch = new Batch(new ArrayList<>(entities.values()), new ArrayList<>(relationships.values()));
        entities.clear();
        relationships.clear();
        openedAt = null;
        return batch;
    }

    private void markOpened(Instant now) {
        if (openedAt == null) {
            openedAt = now;
        }
    }
}
