package br.edu.ifba.ontology.ingestion;

import br.edu.ifba.ontology.MutableClock;
import br.edu.ifba.ontology.cache.CacheKey;
import br.edu.ifba.ontology.cache.ResultCache;
import br.edu.ifba.ontology.core.EdgeType;
import br.edu.ifba.ontology.core.QueryResult;
import br.edu.ifba.ontology.core.Question;
import br.edu.ifba.ontology.core.Relationship;
import br.edu.ifba.ontology.metrics.MetricNames;
import br.edu.ifba.ontology.metrics.MetricsSink;
import br.edu.ifba.ontology.metrics.MicrometerMetricsSink;
import br.edu.ifba.ontology.storage.GraphStoragePort;
import br.edu.ifba.ontology.storage.PermanentStorageException;
import br.edu.ifba.ontology.storage.impl.InMemoryGraphStorage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link IngestionPipeline} against the in-memory storage.
 */
@Timeout(20)
class IngestionPipelineTest {

    private static final IngestionPipeline.Settings SETTINGS =
        new IngestionPipeline.Settings(10, Duration.ofMillis(200), 2, 4);

    private InMemoryGraphStorage storage;
    private SimpleMeterRegistry registry;
    private MetricsSink metrics;

    @BeforeEach
    void setUp() {
        storage = new InMemoryGraphStorage(Runnable::run);
        storage.initialize().join();
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetricsSink(registry);
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    private IngestionPipeline pipeline(GraphStoragePort target, BatchCommitListener listener,
                                       IngestionPipeline.Settings settings) {
        return new IngestionPipeline(target, new RecordValidator(Clock.systemUTC()), listener, metrics,
            settings, Clock.systemUTC());
    }

    private IngestionPipeline pipeline() {
        return pipeline(storage, (entities, relationships) -> { }, SETTINGS);
    }

    private static RawRecord edge(String head, String tail, String type, String confidence) {
        return RawRecord.relationship(head, tail, type, confidence);
    }

    private static IngestionReport await(CompletableFuture<IngestionReport> run) {
        return run.orTimeout(10, TimeUnit.SECONDS).join();
    }

    private double counter(String name, String kind) {
        Counter counter = kind == null
            ? registry.find(name).counter()
            : registry.find(name).tag("kind", kind).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Nested
    @DisplayName("Finite sources")
    class FiniteSources {

        @Test
        @DisplayName("entities and relationships end up in storage")
        void testLoadsEverything() {
            RecordSource source = RecordSource.of(List.of(
                List.of(RawRecord.entity("dog", "Dog", "legs=4"), RawRecord.entity("Fido", null, null)),
                List.of(edge("dog", "animal", "SubclassOf", "0.9"), edge("Fido", "dog", "InstanceOf", null))));

            IngestionReport report = await(pipeline().run(source));

            assertEquals(2, report.acceptedEntities());
            assertEquals(2, report.acceptedRelationships());
            assertEquals(0, report.rejected());
            assertEquals(2, report.entitiesWritten());
            assertEquals(2, report.relationshipsWritten());
            assertEquals(0, report.batchesFailed());
            assertTrue(report.batchesCommitted() >= 1);
            assertEquals(2, storage.entityCount());
            assertEquals(2, storage.relationshipCount());
        }

        @Test
        @DisplayName("a duplicated edge within a batch is written once with the last confidence")
        void testDeduplicatesWithinBatch() {
            RecordSource source = RecordSource.of(List.of(List.of(
                edge("dog", "animal", "SubclassOf", "0.5"),
                edge("dog", "animal", "SubclassOf", "0.8"))));
            IngestionPipeline single = pipeline(storage, (e, r) -> { },
                new IngestionPipeline.Settings(10, Duration.ofSeconds(5), 1, 4));

            IngestionReport report = await(single.run(source));

            assertEquals(2, report.acceptedRelationships());
            assertEquals(1, report.relationshipsWritten());
            List<Relationship> stored = storage.getRelationshipsByHead("dog", EdgeType.SUBCLASS_OF).join();
            assertEquals(List.of(new Relationship("dog", "animal", EdgeType.SUBCLASS_OF, 0.8)), stored);
        }

        @Test
        @DisplayName("invalid records are counted and skipped, the rest is loaded")
        void testRejections() {
            RecordSource source = RecordSource.of(List.of(List.of(
                edge("dog", "animal", "SubclassOf", "0.9"),
                edge("dog", "animal", "PartOf", "0.9"),
                edge("cat", "animal", "SubclassOf", "2.0"),
                RawRecord.entity(null, "nameless", null))));

            IngestionReport report = await(pipeline().run(source));

            assertEquals(1, report.acceptedRelationships());
            assertEquals(2, report.rejectedRelationships());
            assertEquals(1, report.rejectedEntities());
            assertEquals(1, storage.relationshipCount());
            assertEquals(2.0, counter(MetricNames.INGESTION_REJECTED, "relationship"));
            assertEquals(1.0, counter(MetricNames.INGESTION_ACCEPTED, "relationship"));
        }

        @Test
        @DisplayName("more records than the batch size are split into several batches")
        void testSplitsBatches() {
            List<List<RawRecord>> chunks = new ArrayList<>();
            for (int c = 0; c < 5; c++) {
                List<RawRecord> chunk = new ArrayList<>();
                for (int i = 0; i < 10; i++) {
                    chunk.add(edge("e" + c + "_" + i, "animal", "SubclassOf", "1.0"));
                }
                chunks.add(chunk);
            }

            IngestionReport report = await(pipeline().run(RecordSource.of(chunks)));

            assertEquals(50, report.relationshipsWritten());
            assertTrue(report.batchesCommitted() >= 5);
            assertEquals(50, storage.relationshipCount());
            assertEquals(report.batchesCommitted(), counter(MetricNames.INGESTION_BATCH_COMMITTED, null));
        }

        @Test
        @DisplayName("an empty source completes with an empty report")
        void testEmptySource() {
            IngestionReport report = await(pipeline().run(RecordSource.of(List.of())));

            assertEquals(0, report.accepted());
            assertEquals(0, report.batchesCommitted());
        }
    }

    @Nested
    @DisplayName("Commit listener")
    class Listener {

        @Test
        @DisplayName("is told about every committed batch")
        void testNotified() {
            AtomicInteger relationships = new AtomicInteger();
            IngestionPipeline withListener = pipeline(storage, (e, r) -> relationships.addAndGet(r), SETTINGS);

            await(withListener.run(RecordSource.of(List.of(List.of(
                edge("dog", "animal", "SubclassOf", "0.9"),
                edge("cat", "animal", "SubclassOf", "0.9"))))));

            assertEquals(2, relationships.get());
        }

        @Test
        @DisplayName("a failing listener does not fail the run")
        void testListenerFailure() {
            IngestionPipeline failing = pipeline(storage, (e, r) -> {
                throw new IllegalStateException("listener broke");
            }, SETTINGS);

            IngestionReport report = await(failing.run(RecordSource.of(List.of(List.of(
                edge("dog", "animal", "SubclassOf", "0.9"))))));

            assertEquals(1, report.relationshipsWritten());
        }

        @Test
        @DisplayName("committing a batch invalidates cached answers")
        void testInvalidatesCache() {
            ResultCache cache = new ResultCache(new ResultCache.Settings(10, Duration.ofMinutes(5)),
                new MutableClock(), MetricsSink.NOOP);
            CacheKey key = CacheKey.of(Question.subclassOf("cat", "animal"));
            cache.put(key, QueryResult.no(1));

            await(pipeline(storage, cache, SETTINGS).run(RecordSource.of(List.of(List.of(
                edge("cat", "animal", "SubclassOf", "0.9"))))));

            assertTrue(cache.get(key).isEmpty());
        }
    }

    @Nested
    @DisplayName("Open-ended sources")
    class OpenEnded {

        @Test
        @DisplayName("a partial batch is flushed once the flush interval passes")
        void testFlushByInterval() throws InterruptedException {
            QueueRecordSource source = new QueueRecordSource(4);
            CompletableFuture<IngestionReport> run = pipeline().run(source);

            source.offer(List.of(edge("dog", "animal", "SubclassOf", "0.9")));

            long deadline = System.currentTimeMillis() + 5_000;
            while (storage.relationshipCount() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(1, storage.relationshipCount());
            assertFalse(run.isDone());

            source.close();
            IngestionReport report = await(run);
            assertEquals(1, report.relationshipsWritten());
        }

        @Test
        @DisplayName("cancelling the run stops it and closes the source")
        void testCancel() throws InterruptedException {
            QueueRecordSource source = new QueueRecordSource(4);
            CompletableFuture<IngestionReport> run = pipeline().run(source);
            source.offer(List.of(edge("dog", "animal", "SubclassOf", "0.9")));

            assertTrue(run.cancel(true));

            assertThrows(CancellationException.class, run::join);
            long deadline = System.currentTimeMillis() + 5_000;
            while (!source.isClosed() && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertTrue(source.isClosed());
        }
    }

    @Nested
    @DisplayName("Backpressure")
    class Backpressure {

        private static final int WORKERS = 2;
        private static final int QUEUE_DEPTH = 2;
        private static final int CHUNKS = 20;

        @Test
        @DisplayName("a stalled store stops the source from being read further")
        void testSlowStorageStallsSource() throws Exception {
            CompletableFuture<Void> gate = new CompletableFuture<>();
            GraphStoragePort slow = mock(GraphStoragePort.class);
            when(slow.storeRelationships(anyList())).thenReturn(gate);

            AtomicInteger pulled = new AtomicInteger();
            RecordSource source = () -> new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return pulled.get() < CHUNKS;
                }

                @Override
                public List<RawRecord> next() {
                    int n = pulled.incrementAndGet();
                    return List.of(edge("breed" + n, "dog", "SubclassOf", "1.0"));
                }
            };
            IngestionPipeline.Settings settings =
                new IngestionPipeline.Settings(1, Duration.ofMillis(200), WORKERS, QUEUE_DEPTH);

            CompletableFuture<IngestionReport> run = pipeline(slow, (e, r) -> { }, settings).run(source);

            // one chunk in each worker's hand, a full queue, and one held by the blocked producer
            int bound = WORKERS + QUEUE_DEPTH + 1;
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (pulled.get() < bound && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            Thread.sleep(300);
            int stalled = pulled.get();
            assertTrue(stalled <= bound, "read " + stalled + " chunks past a stalled store");
            Thread.sleep(300);
            assertEquals(stalled, pulled.get());
            assertFalse(run.isDone());

            gate.complete(null);

            IngestionReport report = await(run);
            assertEquals(CHUNKS, pulled.get());
            assertEquals(CHUNKS, report.acceptedRelationships());
            assertEquals(CHUNKS, report.relationshipsWritten());
            assertEquals(0, report.batchesFailed());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a failed batch write fails the run with a partial report")
        void testBatchFailure() {
            GraphStoragePort broken = mock(GraphStoragePort.class);
            when(broken.storeRelationships(anyList()))
                .thenReturn(CompletableFuture.failedFuture(new PermanentStorageException("disk full")));
            RecordSource source = RecordSource.of(List.of(List.of(
                edge("dog", "animal", "SubclassOf", "0.9"),
                edge("cat", "animal", "SubclassOf", "0.9"))));

            CompletionException thrown = assertThrows(CompletionException.class,
                () -> await(pipeline(broken, (e, r) -> { }, SETTINGS).run(source)));

            IngestionException failure = assertInstanceOf(IngestionException.class, thrown.getCause());
            assertInstanceOf(PermanentStorageException.class, failure.getCause());
            IngestionReport partial = failure.getPartialReport();
            assertEquals(1, partial.batchesFailed());
            assertEquals(0, partial.relationshipsWritten());
            assertEquals(2, partial.acceptedRelationships());
            assertEquals(1.0, counter(MetricNames.INGESTION_BATCH_FAILED, null));
        }

        @Test
        @DisplayName("a source that throws fails the run")
        void testSourceFailure() {
            RecordSource source = () -> new java.util.Iterator<>() {
                @Override
                public boolean hasNext() {
                    return true;
                }

                @Override
                public List<RawRecord> next() {
                    throw new IllegalStateException("upstream went away");
                }
            };

            CompletionException thrown = assertThrows(CompletionException.class,
                () -> await(pipeline().run(source)));

            IngestionException failure = assertInstanceOf(IngestionException.class, thrown.getCause());
            assertEquals("upstream went away", failure.getCause().getMessage());
        }
    }

    @Test
    @DisplayName("settings reject invalid values")
    void testSettingsValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> new IngestionPipeline.Settings(0, Duration.ofSeconds(1), 1, 1));
        assertThrows(IllegalArgumentException.class,
            () -> new IngestionPipeline.Settings(1, Duration.ZERO, 1, 1));
        assertThrows(IllegalArgumentException.class,
            () -> new IngestionPipeline.Settings(1, Duration.ofSeconds(1), 0, 1));
        assertThrows(IllegalArgumentException.class,
            () -> new IngestionPipeline.Settings(1, Duration.ofSeconds(1), 1, 0));
    }
}
