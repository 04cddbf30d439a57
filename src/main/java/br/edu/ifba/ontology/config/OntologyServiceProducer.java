package br.edu.ifba.ontology.config;

import br.edu.ifba.ontology.cache.ResultCache;
import br.edu.ifba.ontology.ingestion.IngestionPipeline;
import br.edu.ifba.ontology.ingestion.RecordValidator;
import br.edu.ifba.ontology.metrics.MetricsSink;
import br.edu.ifba.ontology.metrics.MicrometerMetricsSink;
import br.edu.ifba.ontology.query.QueryEngine;
import br.edu.ifba.ontology.query.QueryOrchestrator;
import br.edu.ifba.ontology.resilience.BreakerEventLogger;
import br.edu.ifba.ontology.resilience.TransientFailurePredicate;
import br.edu.ifba.ontology.storage.GraphStoragePort;
import br.edu.ifba.ontology.storage.impl.GuardedGraphStorage;
import br.edu.ifba.ontology.storage.impl.InMemoryGraphStorage;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CDI producer that wires the reasoner components.
 *
 * <p>Components are built once on startup, in dependency order:</p>
 * <ol>
 *   <li>shared executor and in-memory storage backend</li>
 *   <li>the guarded storage port, breaker and call timeout around the backend</li>
 *   <li>result cache</li>
 *   <li>query engine and orchestrator over the guarded port</li>
 *   <li>ingestion pipeline over the guarded port, committing into the cache</li>
 * </ol>
 *
 * <p>Only the guarded port is exposed as {@link GraphStoragePort}; nothing outside this
 * class sees the raw backend.</p>
 */
@ApplicationScoped
public class OntologyServiceProducer {

    private static final Logger logger = LoggerFactory.getLogger(OntologyServiceProducer.class);

    static final String BREAKER_NAME = "graph-storage";

    @Inject
    OntologyConfig config;

    @Inject
    MeterRegistry registry;

    @Inject
    BreakerEventLogger breakerEventLogger;

    private ExecutorService executor;
    private InMemoryGraphStorage backend;
    private GuardedGraphStorage guardedStorage;
    private MetricsSink metrics;
    private ResultCache cache;
    private QueryEngine engine;
    private QueryOrchestrator orchestrator;
    private IngestionPipeline pipeline;

    @PostConstruct
    void initialize() {
        config.validate();
        final Clock clock = Clock.systemUTC();
        final TransientFailurePredicate transientFailure = new TransientFailurePredicate();

        executor = Executors.newFixedThreadPool(config.executor().threads(), storageThreads());
        metrics = new MicrometerMetricsSink(registry);

        backend = new InMemoryGraphStorage(executor);
        backend.initialize().join();

        guardedStorage = new GuardedGraphStorage(
            backend,
            BREAKER_NAME,
            new GuardedGraphStorage.Settings(
                config.breaker().failureThreshold(),
                config.breaker().resetTimeout(),
                config.breaker().callTimeout()),
            metrics,
            breakerEventLogger,
            transientFailure);

        cache = new ResultCache(
            new ResultCache.Settings(config.cache().capacity(), config.cache().ttl()),
            clock,
            metrics);

        engine = new QueryEngine(
            guardedStorage,
            new QueryEngine.Settings(config.query().maxDepth(), config.query().timeout()),
            transientFailure);
        orchestrator = new QueryOrchestrator(
            guardedStorage,
            cache,
            engine,
            metrics,
            new QueryOrchestrator.Settings(config.query().validateEntities()));

        pipeline = new IngestionPipeline(
            guardedStorage,
            new RecordValidator(clock),
            cache,
            metrics,
            new IngestionPipeline.Settings(
                config.ingestion().batchSize(),
                config.ingestion().flushInterval(),
                config.ingestion().workers(),
                config.ingestion().queueDepth()),
            clock);

        logger.info("Ontology reasoner ready (maxDepth={}, cacheCapacity={}, breakerThreshold={}, ingestionWorkers={})",
            config.query().maxDepth(), config.cache().capacity(),
            config.breaker().failureThreshold(), config.ingestion().workers());
    }

    @PreDestroy
    void shutdown() {
        logger.info("Shutting down ontology reasoner");
        if (guardedStorage != null) {
            guardedStorage.close();
        }
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.warn("Storage executor did not terminate in time, forcing shutdown");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
    }

    @Produces
    @Singleton
    public GraphStoragePort produceGraphStorage() {
        return guardedStorage;
    }

    @Produces
    @Singleton
    public MetricsSink produceMetricsSink() {
        return metrics;
    }

    @Produces
    @Singleton
    public ResultCache produceResultCache() {
        return cache;
    }

    @Produces
    @Singleton
    public QueryEngine produceQueryEngine() {
        return engine;
    }

    @Produces
    @Singleton
    public QueryOrchestrator produceQueryOrchestrator() {
        return orchestrator;
    }

    @Produces
    @Singleton
    public IngestionPipeline produceIngestionPipeline() {
        return pipeline;
    }

    private static ThreadFactory storageThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ontology-storage-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
