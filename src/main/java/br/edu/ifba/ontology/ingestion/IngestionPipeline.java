package br.edu.ifba.ontology.ingestion;

import br.edu.ifba.ontology.metrics.MetricNames;
import br.edu.ifba.ontology.metrics.MetricsSink;
import br.edu.ifba.ontology.resilience.TransientFailurePredicate;
import br.edu.ifba.ontology.storage.GraphStoragePort;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Concurrent loader from a {@link RecordSource} into the graph storage.
 *
 * <h2>Flow</h2>
 * <p>One producer thread pulls raw batches from the source into a bounded queue of
 * {@code queueDepth} batches. {@code workers} threads take from the queue, validate
 * each record, and accumulate the survivors in their own {@link BatchAccumulator}.
 * An accumulator is flushed when it holds {@code batchSize} distinct records or its
 * oldest record has waited {@code flushInterval}. A flush writes the entities, then the
 * relationships, and waits for storage before the worker takes more input, so a slow
 * backend fills the queue and blocks the producer.</p>
 *
 * <h2>Failures</h2>
 * <p>Invalid records are counted and skipped. A failed batch write stops the run: the
 * other workers finish their current record and exit without flushing, the producer is
 * interrupted, and the returned future fails with an {@link IngestionException}
 * carrying the partial report. A failing source stops the run the same way.</p>
 *
 * <p>After each committed batch the {@link BatchCommitListener} is notified.</p>
 */
public final class IngestionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(IngestionPipeline.class);

    private static final List<RawRecord> END_OF_INPUT = Collections.unmodifiableList(new ArrayList<>());
    private static final long STOP_CHECK_MILLIS = 100;

    /**
     * Pipeline tuning.
     *
     * @param batchSize distinct records per storage write
     * @param flushInterval maximum age of a partially filled batch
     * @param workers concurrent validating and writing workers
     * @param queueDepth raw batches buffered between the source and the workers
     */
    public record Settings(int batchSize, @NotNull Duration flushInterval, int workers, int queueDepth) {
        public Settings {
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
            }
            Objects.requireNonNull(flushInterval, "flushInterval must not be null");
            if (flushInterval.isNegative() || flushInterval.isZero()) {
                throw new IllegalArgumentException("flushInterval must be positive");
            }
            if (workers < 1) {
                throw new IllegalArgumentException("workers must be >= 1, got " + workers);
            }
            if (queueDepth < 1) {
                throw new IllegalArgumentException("queueDepth must be >= 1, got " + queueDepth);
            }
        }
    }

    private static final AtomicInteger RUN_SEQUENCE = new AtomicInteger();

    private final GraphStoragePort storage;
    private final RecordValidator validator;
    private final BatchCommitListener listener;
    private final MetricsSink metrics;
    private final Settings settings;
    private final Clock clock;

    public IngestionPipeline(@NotNull GraphStoragePort storage,
                             @NotNull RecordValidator validator,
                             @NotNull BatchCommitListener listener,
                             @NotNull MetricsSink metrics,
                             @NotNull Settings settings,
                             @NotNull Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Starts ingesting {@code source} and returns immediately.
     *
     * <p>The future completes when a finite source is exhausted and every worker has
     * flushed, or when an open-ended source is closed. Cancelling the future stops the
     * run without flushing. The source is closed when the run ends.</p>
     *
     * @param source the records to load
     * @return the run summary
     */
    @NotNull
    public CompletableFuture<IngestionReport> run(@NotNull RecordSource source) {
        Objects.requireNonNull(source, "source must not be null");
        Run run = new Run(source, RUN_SEQUENCE.incrementAndGet());
        run.start();
        return run.result;
    }

    @NotNull
    public Settings getSettings() {
        return settings;
    }

    /**
     * State of one {@link #run} call.
     */
    private final class Run {
        final RecordSource source;
        final int id;
        final long startNanos = System.nanoTime();
        final BlockingQueue<List<RawRecord>> queue = new ArrayBlockingQueue<>(settings.queueDepth());
        final IngestionReport.Tally tally = new IngestionReport.Tally();
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        final CompletableFuture<IngestionReport> result = new CompletableFuture<>();
        final ExecutorService pool;
        volatile boolean stopped;
        volatile Thread producerThread;

        Run(RecordSource source, int id) {
            this.source = source;
            this.id = id;
            this.pool = Executors.newFixedThreadPool(settings.workers() + 1, threadFactory(id));
        }

        void start() {
            logger.info("Ingestion run {} started (workers={}, batchSize={}, queueDepth={})",
                id, settings.workers(), settings.batchSize(), settings.queueDepth());

            List<CompletableFuture<Void>> tasks = new ArrayList<>();
            tasks.add(CompletableFuture.runAsync(this::produce, pool));
            for (int i = 0; i < settings.workers(); i++) {
                tasks.add(CompletableFuture.runAsync(this::work, pool));
            }

            result.whenComplete((report, error) -> {
                if (result.isCancelled()) {
                    logger.info("Ingestion run {} cancelled", id);
                    stop();
                }
            });

            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> finish(error));
        }

        private void produce() {
            producerThread = Thread.currentThread();
            try {
                Iterator<List<RawRecord>> batches = source.batches();
                while (!stopped && batches.hasNext()) {
                    List<RawRecord> chunk = batches.next();
                    if (chunk == null || chunk.isEmpty()) {
                        continue;
                    }
                    if (!enqueue(chunk)) {
                        return;
                    }
                }
                for (int i = 0; i < settings.workers(); i++) {
                    if (!enqueue(END_OF_INPUT)) {
                        return;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (!stopped) {
                    fail(e);
                }
            } catch (RuntimeException e) {
                if (!stopped) {
                    logger.error("Ingestion run {}: reading the source failed: {}", id, e.getMessage());
                }
                fail(e);
            } finally {
                producerThread = null;
                closeSource();
            }
        }

        /**
         * Blocks while the queue is full. Returns false when the run was stopped meanwhile.
         */
        private boolean enqueue(List<RawRecord> chunk) throws InterruptedException {
            while (!queue.offer(chunk, STOP_CHECK_MILLIS, TimeUnit.MILLISECONDS)) {
                if (stopped) {
                    return false;
                }
            }
            return true;
        }

        private void work() {
            BatchAccumulator accumulator = new BatchAccumulator(settings.batchSize(), settings.flushInterval());
            try {
                while (!stopped) {
                    long waitMillis = Math.max(1, Math.min(STOP_CHECK_MILLIS,
                        accumulator.timeUntilDue(clock.instant()).toMillis()));
                    List<RawRecord> chunk = queue.poll(waitMillis, TimeUnit.MILLISECONDS);
                    if (chunk == END_OF_INPUT) {
                        flush(accumulator);
                        return;
                    }
                    if (chunk != null) {
                        accept(chunk, accumulator);
                    }
                    if (accumulator.isDue(clock.instant())) {
                        flush(accumulator);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (!stopped) {
                    fail(e);
                }
            } catch (RuntimeException e) {
                fail(e);
            }
        }

        private void accept(List<RawRecord> chunk, BatchAccumulator accumulator) {
            for (RawRecord record : chunk) {
                if (stopped) {
                    return;
                }
                try {
                    if (record.kind() == RecordKind.ENTITY) {
                        accumulator.add(validator.toEntity(record), clock.instant());
                    } else {
                        accumulator.add(validator.toRelationship(record), clock.instant());
                    }
                    tally.accepted(record.kind());
                    metrics.increment(MetricNames.INGESTION_ACCEPTED, Map.of("kind", record.kind().tag()));
                } catch (RecordValidationException e) {
                    tally.rejected(record.kind());
                    metrics.increment(MetricNames.INGESTION_REJECTED, Map.of("kind", record.kind().tag()));
                    logger.debug("Rejected {} record: {}", record.kind().tag(), e.getMessage());
                }
                if (accumulator.isFull()) {
                    flush(accumulator);
                }
            }
        }

        private void flush(BatchAccumulator accumulator) {
            BatchAccumulator.Batch batch = accumulator.drain();
            if (batch.isEmpty()) {
                return;
            }
            try {
                if (!batch.entities().isEmpty()) {
                    storage.storeEntities(batch.entities()).join();
                }
                if (!batch.relationships().isEmpty()) {
                    storage.storeRelationships(batch.relationships()).join();
                }
            } catch (RuntimeException e) {
                Throwable cause = TransientFailurePredicate.unwrap(e);
                tally.failed();
                metrics.increment(MetricNames.INGESTION_BATCH_FAILED);
                logger.error("Ingestion run {}: batch of {} entities and {} relationships failed: {}",
                    id, batch.entities().size(), batch.relationships().size(), cause.getMessage());
                throw new BatchWriteFailure(cause);
            }

            tally.committed(batch);
            metrics.increment(MetricNames.INGESTION_BATCH_COMMITTED);
            metrics.observe(MetricNames.INGESTION_BATCH_SIZE, batch.size());
            logger.debug("Ingestion run {}: committed batch of {} entities and {} relationships",
                id, batch.entities().size(), batch.relationships().size());
            try {
                listener.onBatchCommitted(batch.entities().size(), batch.relationships().size());
            } catch (RuntimeException e) {
                logger.warn("Ingestion run {}: commit listener failed: {}", id, e.getMessage(), e);
            }
        }

        private void fail(Throwable error) {
            Throwable cause = error instanceof BatchWriteFailure ? error.getCause() : error;
            failure.compareAndSet(null, cause);
            stop();
        }

        private void stop() {
            stopped = true;
            Thread thread = producerThread;
            if (thread != null) {
                thread.interrupt();
            }
        }

        private void closeSource() {
            try {
                source.close();
            } catch (RuntimeException e) {
                logger.warn("Ingestion run {}: closing the source failed: {}", id, e.getMessage());
            }
        }

        private void finish(Throwable taskError) {
            pool.shutdown();
            if (taskError != null) {
                failure.compareAndSet(null, TransientFailurePredicate.unwrap(taskError));
            }
            IngestionReport report = tally.snapshot(Duration.ofNanos(System.nanoTime() - startNanos));
            if (report.rejected() > 0) {
                logger.warn("Ingestion run {}: rejected {} invalid records ({} entities, {} relationships)",
                    id, report.rejected(), report.rejectedEntities(), report.rejectedRelationships());
            }
            Throwable error = failure.get();
            if (error != null && !result.isCancelled()) {
                logger.error("Ingestion run {} failed after {} committed batches: {}",
                    id, report.batchesCommitted(), error.getMessage());
                result.completeExceptionally(new IngestionException(
                    "Ingestion run " + id + " failed: " + error.getMessage(), error, report));
                return;
            }
            logger.info("Ingestion run {} finished: {} accepted, {} rejected, {} batches, {} entities, {} relationships in {} ms",
                id, report.accepted(), report.rejected(), report.batchesCommitted(),
                report.entitiesWritten(), report.relationshipsWritten(), report.elapsed().toMillis());
            result.complete(report);
        }
    }

    private static ThreadFactory threadFactory(int runId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ontology-ingest-" + runId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Unwinds a worker after a failed storage write.
     */
    private static final class BatchWriteFailure extends RuntimeException {
        BatchWriteFailure(Throwable cause) {
            super(cause);
        }
    }
}
