package br.edu.ifba.ontology.storage.impl;

import br.edu.ifba.ontology.core.EdgeType;
import br.edu.ifba.ontology.core.Entity;
import br.edu.ifba.ontology.core.Relationship;
import br.edu.ifba.ontology.metrics.MetricNames;
import br.edu.ifba.ontology.metrics.MetricsSink;
import br.edu.ifba.ontology.resilience.BreakerEventLogger;
import br.edu.ifba.ontology.resilience.TransientFailurePredicate;
import br.edu.ifba.ontology.storage.GraphStoragePort;
import br.edu.ifba.ontology.storage.HealthStatus;
import br.edu.ifba.ontology.storage.PermanentStorageException;
import br.edu.ifba.ontology.storage.StorageException;
import io.smallrye.faulttolerance.api.CircuitBreakerState;
import io.smallrye.faulttolerance.api.FaultTolerance;
import org.eclipse.microprofile.faulttolerance.exceptions.CircuitBreakerOpenException;
import org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Decorator that routes every storage call through a SmallRye Fault Tolerance circuit
 * breaker with a per-call timeout, and records its latency under
 * {@link MetricNames#STORAGE_LATENCY}.
 *
 * <h2>Breaker policy:</h2>
 * <ul>
 *   <li>opens when the last {@code failureThreshold} calls all failed transiently</li>
 *   <li>admits a single trial call once {@code resetTimeout} has passed</li>
 *   <li>a trial that succeeds, or fails permanently, closes it again</li>
 *   <li>a call that runs past {@code callTimeout} fails transiently, so a hung trial
 *       reopens the breaker instead of holding the trial slot</li>
 * </ul>
 *
 * <p>Delegate failures are classified before the breaker sees them: transient ones keep
 * their type, cancellations pass through, everything else surfaces as
 * {@link PermanentStorageException}. Only transient failures and timeouts count. Rejected calls fail with {@link CircuitBreakerOpenException}.</p>
 *
 * <p>{@link #healthCheck()} does not go through the breaker: it reports DOWN while the
 * breaker is OPEN and DEGRADED while it is HALF_OPEN without touching the backend.</p>
 *
 * <p>Needs a running Quarkus container, which backs the programmatic fault tolerance API.</p>
 */
public class GuardedGraphStorage implements GraphStoragePort {

    private static final Logger logger = LoggerFactory.getLogger(GuardedGraphStorage.class);

    /**
     * Breaker and timeout settings.
     *
     * @param failureThreshold size of the rolling request window that opens the breaker
     * @param resetTimeout time spent OPEN before a trial call is admitted
     * @param callTimeout longest a single guarded call may run
     */
    public record Settings(int failureThreshold, @NotNull Duration resetTimeout, @NotNull Duration callTimeout) {
        public Settings {
            Objects.requireNonNull(resetTimeout, "resetTimeout must not be null");
            Objects.requireNonNull(callTimeout, "callTimeout must not be null");
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be >= 1");
            }
            if (resetTimeout.isNegative()) {
                throw new IllegalArgumentException("resetTimeout must not be negative");
            }
            if (callTimeout.isNegative() || callTimeout.isZero()) {
                throw new IllegalArgumentException("callTimeout must be positive");
            }
        }
    }

    private final GraphStoragePort delegate;
    private final String name;
    private final MetricsSink metrics;
    private final BreakerEventLogger eventLogger;
    private final Predicate<Throwable> transientFailure;

    private final AtomicReference<CircuitBreakerState> state = new AtomicReference<>(CircuitBreakerState.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<Throwable> lastFailure = new AtomicReference<>();

    private final FaultTolerance<CompletionStage<Object>> guard;

    public GuardedGraphStorage(@NotNull GraphStoragePort delegate,
                               @NotNull String name,
                               @NotNull Settings settings,
                               @NotNull MetricsSink metrics,
                               @NotNull BreakerEventLogger eventLogger,
                               @NotNull Predicate<Throwable> transientFailure) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.eventLogger = Objects.requireNonNull(eventLogger, "eventLogger must not be null");
        this.transientFailure = Objects.requireNonNull(transientFailure, "transientFailure must not be null");

        this.guard = FaultTolerance.<Object>createAsync()
            .withCircuitBreaker()
                .requestVolumeThreshold(settings.failureThreshold())
                .failureRatio(1.0)
                .delay(settings.resetTimeout().toMillis(), ChronoUnit.MILLIS)
                .successThreshold(1)
                .skipOn(List.of(PermanentStorageException.class, CancellationException.class))
                .onStateChange(this::onStateChange)
                .done()
            .withTimeout()
                .duration(settings.callTimeout().toMillis(), ChronoUnit.MILLIS)
                .done()
            .build();
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return delegate.initialize();
    }

    @Override
    public CompletableFuture<Optional<Entity>> getEntity(@NotNull String id) {
        return guarded("getEntity", () -> delegate.getEntity(id));
    }

    @Override
    public CompletableFuture<List<Relationship>> getRelationshipsByHead(@NotNull String headId, @Nullable EdgeType edgeType) {
        return guarded("getRelationshipsByHead", () -> delegate.getRelationshipsByHead(headId, edgeType));
    }

    @Override
    public CompletableFuture<Void> storeEntities(@NotNull List<Entity> batch) {
        return guarded("storeEntities", () -> delegate.storeEntities(batch));
    }

    @Override
    public CompletableFuture<Void> storeRelationships(@NotNull List<Relationship> batch) {
        return guarded("storeRelationships", () -> delegate.storeRelationships(batch));
    }

    @Override
    public CompletableFuture<HealthStatus> healthCheck() {
        switch (state.get()) {
            case OPEN:
                return CompletableFuture.completedFuture(HealthStatus.DOWN);
            case HALF_OPEN:
                return CompletableFuture.completedFuture(HealthStatus.DEGRADED);
            default:
                return delegate.healthCheck()
                    .exceptionally(e -> {
                        logger.warn("Storage health check failed: {}", e.getMessage());
                        return HealthStatus.DOWN;
                    });
        }
    }

    /**
     * @return the breaker name used in logs
     */
    @NotNull
    public String getName() {
        return name;
    }

    /**
     * @return the breaker state as of its last transition
     */
    @NotNull
    public CircuitBreakerState breakerState() {
        return state.get();
    }

    @Override
    public void close() {
        delegate.close();
    }

    @SuppressWarnings("unchecked")
    private <T> CompletableFuture<T> guarded(String operation, Supplier<CompletableFuture<T>> call) {
        final long start = System.nanoTime();
        final CompletableFuture<T> result = new CompletableFuture<>();

        CompletionStage<Object> stage;
        try {
            stage = guard.get(() -> (CompletionStage<Object>) (CompletionStage<?>) classified(call));
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        stage.whenComplete((value, failure) -> {
            String outcome;
            if (failure == null) {
                outcome = "success";
            } else if (TransientFailurePredicate.unwrap(failure) instanceof CircuitBreakerOpenException) {
                outcome = "rejected";
                eventLogger.logRejected(name, operation);
                metrics.increment(MetricNames.BREAKER_REJECTED, Map.of("operation", operation));
            } else {
                outcome = "failure";
                Throwable cause = TransientFailurePredicate.unwrap(failure);
                if (cause instanceof TimeoutException) {
                    consecutiveFailures.incrementAndGet();
                    lastFailure.set(cause);
                }
            }
            double millis = (System.nanoTime() - start) / 1_000_000.0;
            metrics.observe(MetricNames.STORAGE_LATENCY, millis, Map.of("operation", operation, "outcome", outcome));

            if (failure == null) {
                result.complete((T) value);
            } else {
                result.completeExceptionally(TransientFailurePredicate.unwrap(failure));
            }
        });
        return result;
    }

    /**
     * Runs the delegate call and settles its failure into the shape the breaker counts.
     */
    private <T> CompletableFuture<T> classified(Supplier<CompletableFuture<T>> call) {
        CompletableFuture<T> source;
        try {
            source = call.get();
        } catch (RuntimeException e) {
            source = CompletableFuture.failedFuture(e);
        }

        final CompletableFuture<T> settled = new CompletableFuture<>();
        source.whenComplete((value, failure) -> {
            if (failure == null) {
                consecutiveFailures.set(0);
                settled.complete(value);
                return;
            }
            Throwable cause = TransientFailurePredicate.unwrap(failure);
            if (cause instanceof CancellationException) {
                settled.completeExceptionally(cause);
            } else if (transientFailure.test(cause)) {
                consecutiveFailures.incrementAndGet();
                lastFailure.set(cause);
                settled.completeExceptionally(cause);
            } else {
                consecutiveFailures.set(0);
                settled.completeExceptionally(cause instanceof PermanentStorageException
                    ? cause
                    : permanent(cause));
            }
        });
        return settled;
    }

    private static PermanentStorageException permanent(Throwable cause) {
        String message = cause instanceof StorageException
            ? cause.getMessage()
            : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new PermanentStorageException(message, cause);
    }

    private void onStateChange(CircuitBreakerState next) {
        CircuitBreakerState previous = state.getAndSet(next);
        if (previous == next) {
            return;
        }
        eventLogger.logTransition(name, previous, next, consecutiveFailures.get(),
            next == CircuitBreakerState.OPEN ? lastFailure.get() : null);
        metrics.increment(MetricNames.BREAKER_TRANSITION, Map.of("state", next.name()));
    }
}
