package br.edu.ifba.ontology.query;

import br.edu.ifba.ontology.cache.CacheKey;
import br.edu.ifba.ontology.cache.ResultCache;
import br.edu.ifba.ontology.core.Entity;
import br.edu.ifba.ontology.core.Question;
import br.edu.ifba.ontology.core.QueryResult;
import br.edu.ifba.ontology.core.UnknownReason;
import br.edu.ifba.ontology.metrics.MetricNames;
import br.edu.ifba.ontology.metrics.MetricsSink;
import br.edu.ifba.ontology.resilience.TransientFailurePredicate;
import br.edu.ifba.ontology.storage.GraphStoragePort;
import br.edu.ifba.ontology.storage.HealthStatus;
import org.eclipse.microprofile.faulttolerance.exceptions.CircuitBreakerOpenException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Entry point for answering questions.
 *
 * <p>Each call checks the {@link ResultCache} first. On a miss the subject is
 * optionally checked for existence, then the {@link QueryEngine} runs. YES, NO and
 * depth-limited UNKNOWN answers are cached; UNKNOWN caused by breaker, timeout or
 * storage problems is not, so the next call retries the backend.</p>
 *
 * <p>Cancelling the returned future cancels the traversal and nothing is cached.</p>
 */
public final class QueryOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(QueryOrchestrator.class);

    /**
     * @param validateEntities answer UNKNOWN / ENTITY_NOT_FOUND when the subject is not stored
     */
    public record Settings(boolean validateEntities) {
    }

    private final GraphStoragePort storage;
    private final ResultCache cache;
    private final QueryEngine engine;
    private final MetricsSink metrics;
    private final Settings settings;
    private final Predicate<Throwable> transientFailure = new TransientFailurePredicate();

    public QueryOrchestrator(@NotNull GraphStoragePort storage,
                             @NotNull ResultCache cache,
                             @NotNull QueryEngine engine,
                             @NotNull MetricsSink metrics,
                             @NotNull Settings settings) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Answers a question, from cache when possible.
     *
     * @param asked the typed question; surrounding whitespace on its ids is ignored
     * @return future completing with the answer; never completes exceptionally except on cancellation
     */
    @NotNull
    public CompletableFuture<QueryResult> ask(@NotNull Question asked) {
        Objects.requireNonNull(asked, "question must not be null");
        final long start = System.nanoTime();
        // the cache key and the traversal both use the trimmed ids
        final Question question = asked.normalized();
        final CacheKey key = CacheKey.of(question);
        final long generation = cache.generation();

        Optional<QueryResult> cached = cache.get(key);
        if (cached.isPresent()) {
            QueryResult hit = cached.get()
                .withCacheHit(true)
                .withElapsed(Duration.ofNanos(System.nanoTime() - start));
            record(question, hit);
            logger.debug("Cache hit for {}: {}", question, hit.outcome());
            return CompletableFuture.completedFuture(hit);
        }

        final CompletableFuture<QueryResult> response = new CompletableFuture<>();
        final AtomicReference<CompletableFuture<QueryResult>> traversal = new AtomicReference<>();
        final CompletableFuture<QueryResult> work;
        if (settings.validateEntities()) {
            work = validate(question).thenCompose(missing -> {
                if (missing.isPresent()) {
                    return CompletableFuture.completedFuture(missing.get());
                }
                if (response.isDone()) {
                    return CompletableFuture.failedFuture(new CancellationException("query cancelled"));
                }
                traversal.set(engine.answer(question));
                return traversal.get();
            });
        } else {
            traversal.set(engine.answer(question));
            work = traversal.get();
        }

        response.whenComplete((r, failure) -> {
            if (response.isCancelled()) {
                work.cancel(false);
                CompletableFuture<QueryResult> running = traversal.get();
                if (running != null) {
                    running.cancel(false);
                }
            }
        });

        work.whenComplete((result, failure) -> {
            QueryResult outcome = result;
            if (failure != null) {
                Throwable cause = TransientFailurePredicate.unwrap(failure);
                if (cause instanceof CancellationException) {
                    response.cancel(false);
                    return;
                }
                logger.warn("Query {} failed unexpectedly: {}", question, cause.getMessage());
                outcome = QueryResult.unknown(UnknownReason.STORAGE_ERROR, 0);
            }
            QueryResult answer = outcome.withElapsed(Duration.ofNanos(System.nanoTime() - start));
            if (response.complete(answer)) {
                if (isCacheable(answer)) {
                    cache.putIfCurrent(key, answer, generation);
                }
                record(question, answer);
            }
        });
        return response;
    }

    /**
     * @return health of the guarded storage
     */
    @NotNull
    public CompletableFuture<HealthStatus> health() {
        return storage.healthCheck();
    }

    private CompletableFuture<Optional<QueryResult>> validate(Question question) {
        return lookup(question.subject())
            .thenApply(subject -> {
                if (subject.isEmpty()) {
                    logger.debug("Unknown subject in {}", question);
                    return Optional.of(QueryResult.unknown(UnknownReason.ENTITY_NOT_FOUND, 0));
                }
                return Optional.<QueryResult>empty();
            })
            .exceptionally(failure -> {
                Throwable cause = TransientFailurePredicate.unwrap(failure);
                if (cause instanceof CancellationException c) {
                    throw c;
                }
                UnknownReason reason;
                if (cause instanceof CircuitBreakerOpenException) {
                    reason = UnknownReason.BREAKER_OPEN;
                } else if (transientFailure.test(cause)) {
                    reason = UnknownReason.BACKEND_UNAVAILABLE;
                } else {
                    reason = UnknownReason.STORAGE_ERROR;
                }
                logger.debug("Entity validation for {} failed: {} ({})", question, reason, cause.getMessage());
                return Optional.of(QueryResult.unknown(reason, 0));
            });
    }

    private CompletableFuture<Optional<Entity>> lookup(String id) {
        try {
            return storage.getEntity(id);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static boolean isCacheable(QueryResult result) {
        return result.reason() == null || result.reason().isDeterministic();
    }

    private void record(Question question, QueryResult result) {
        Map<String, String> tags = Map.of(
            "type", question.type().name(),
            "outcome", result.outcome().name(),
            "cache_hit", Boolean.toString(result.cacheHit()));
        metrics.increment(MetricNames.QUERY_TOTAL, tags);
        metrics.observe(MetricNames.QUERY_LATENCY, result.elapsed().toNanos() / 1_000_000.0,
            Map.of("type", question.type().name()));
        if (!result.cacheHit()) {
            metrics.observe(MetricNames.QUERY_ENTITIES_VISITED, result.entitiesVisited());
        }
    }
}
