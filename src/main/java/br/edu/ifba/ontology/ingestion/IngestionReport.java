package br.edu.ifba.ontology.ingestion;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Summary of one ingestion run.
 *
 * @param acceptedEntities entity records that passed validation
 * @param acceptedRelationships relationship records that passed validation
 * @param rejectedEntities entity records rejected by validation
 * @param rejectedRelationships relationship records rejected by validation
 * @param batchesCommitted batches written to storage
 * @param batchesFailed batches whose write failed
 * @param entitiesWritten distinct entities written, after in-batch dedup
 * @param relationshipsWritten distinct relationships written, after in-batch dedup
 * @param elapsed wall-clock duration of the run
 */
public record IngestionReport(
    int acceptedEntities,
    int acceptedRelationships,
    int rejectedEntities,
    int rejectedRelationships,
    int batchesCommitted,
    int batchesFailed,
    int entitiesWritten,
    int relationshipsWritten,
    @NotNull Duration elapsed
) {

    public int accepted() {
        return acceptedEntities + acceptedRelationships;
    }

    public int rejected() {
        return rejectedEntities + rejectedRelationships;
    }

    /**
     * Thread-safe running counts shared by the workers of one run.
     */
    static final class Tally {
        private final AtomicInteger acceptedEntities = new AtomicInteger();
        private final AtomicInteger acceptedRelationships = new AtomicInteger();
        private final AtomicInteger rejectedEntities = new AtomicInteger();
        private final AtomicInteger rejectedRelationships = new AtomicInteger();
        private final AtomicInteger batchesCommitted = new AtomicInteger();
        private final AtomicInteger batchesFailed = new AtomicInteger();
        private final AtomicInteger entitiesWritten = new AtomicInteger();
        private final AtomicInteger relationshipsWritten = new AtomicInteger();

        void accepted(RecordKind kind) {
            (kind == RecordKind.ENTITY ? acceptedEntities : acceptedRelationships).incrementAndGet();
        }

        void rejected(RecordKind kind) {
            (kind == RecordKind.ENTITY ? rejectedEntities : rejectedRelationships).incrementAndGet();
        }

        void committed(BatchAccumulator.Batch batch) {
            batchesCommitted.incrementAndGet();
            entitiesWritten.addAndGet(batch.entities().size());
            relationshipsWritten.addAndGet(batch.relationships().size());
        }

        void failed() {
            batchesFailed.incrementAndGet();
        }

        IngestionReport snapshot(Duration elapsed) {
            return new IngestionReport(
                acceptedEntities.get(),
                acceptedRelationships.get(),
                rejectedEntities.get(),
                rejectedRelationships.get(),
                batchesCommitted.get(),
                batchesFailed.get(),
                entitiesWritten.get(),
                relationshipsWritten.get(),
                elapsed);
        }
    }
}
