package br.edu.ifba.ontology.query;

import br.edu.ifba.ontology.core.EdgeType;
import br.edu.ifba.ontology.core.Question;
import br.edu.ifba.ontology.core.QueryResult;
import br.edu.ifba.ontology.core.Relationship;
import br.edu.ifba.ontology.core.UnknownReason;
import br.edu.ifba.ontology.resilience.TransientFailurePredicate;
import br.edu.ifba.ontology.storage.GraphStoragePort;
import org.eclipse.microprofile.faulttolerance.exceptions.CircuitBreakerOpenException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Answers typed questions by breadth-first traversal of the ontology graph.
 *
 * <h2>Algorithm</h2>
 * <p>The frontier is expanded one level at a time. All entities of a level are looked
 * up concurrently through the storage port, then their edges are processed in entity
 * id order so the outcome does not depend on completion order. A global visited set,
 * seeded with the subject, guarantees no entity is expanded twice. The search stops
 * when</p>
 * <ul>
 *   <li>a goal edge is found on the current level: YES with the best such path,</li>
 *   <li>the frontier is empty: NO,</li>
 *   <li>the frontier is non-empty but {@code maxDepth} edges have been walked:
 *       UNKNOWN with {@code maxDepthExceeded},</li>
 *   <li>the time budget runs out: UNKNOWN / TIMEOUT.</li>
 * </ul>
 *
 * <p>The goal test runs on every edge tail, visited or not, so
 * {@code SubclassOf(A, A)} holds exactly when a SubclassOf cycle leads back to A.
 * Edges with zero confidence carry no evidence and are ignored.</p>
 *
 * <h2>Scoring</h2>
 * <p>A path scores the product of its edge confidences. When several paths reach the
 * same entity or the goal on one level, {@link TraversalPath#isBetterThan} picks the
 * survivor.</p>
 *
 * <h2>Failures</h2>
 * <p>The returned future never completes exceptionally because of storage: a breaker
 * rejection, storage failure or timeout resolves to UNKNOWN with the matching
 * {@link UnknownReason}, and partial progress is discarded. Cancelling the returned
 * future stops the traversal before its next storage call.</p>
 */
public final class QueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    /**
     * Traversal limits.
     *
     * @param maxDepth maximum number of edges in a path
     * @param timeout wall-clock budget of one traversal
     */
    public record Settings(int maxDepth, @NotNull Duration timeout) {
        public Settings {
            if (maxDepth < 1) {
                throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
            }
            Objects.requireNonNull(timeout, "timeout must not be null");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
        }
    }

    private final GraphStoragePort storage;
    private final Settings settings;
    private final Predicate<Throwable> transientFailure;

    public QueryEngine(@NotNull GraphStoragePort storage, @NotNull Settings settings) {
        this(storage, settings, new TransientFailurePredicate());
    }

    public QueryEngine(@NotNull GraphStoragePort storage,
                       @NotNull Settings settings,
                       @NotNull Predicate<Throwable> transientFailure) {
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.transientFailure = Objects.requireNonNull(transientFailure, "transientFailure must not be null");
    }

    /**
     * Answers a question.
     *
     * @param question the typed question
     * @return future completing with a well-formed result; {@code cacheHit} is false
     */
    @NotNull
    public CompletableFuture<QueryResult> answer(@NotNull Question question) {
        Objects.requireNonNull(question, "question must not be null");
        Traversal traversal = new Traversal(question, TraversalRule.forQuestion(question.type()), System.nanoTime());
        expandLevel(traversal);
        return traversal.result;
    }

    @NotNull
    public Settings getSettings() {
        return settings;
    }

    private void expandLevel(Traversal t) {
        if (t.result.isDone()) {
            logger.debug("Traversal for {} cancelled at depth {}", t.question, t.depth);
            return;
        }
        if (t.frontier.isEmpty()) {
            t.finish(QueryResult.no(t.entitiesVisited));
            return;
        }
        if (t.depth >= settings.maxDepth()) {
            t.finish(QueryResult.unknown(UnknownReason.DEPTH_EXCEEDED, t.entitiesVisited));
            return;
        }
        long remainingNanos = settings.timeout().toNanos() - (System.nanoTime() - t.startNanos);
        if (remainingNanos <= 0) {
            t.finish(QueryResult.unknown(UnknownReason.TIMEOUT, t.entitiesVisited));
            return;
        }

        final List<String> nodes = new ArrayList<>(t.frontier.keySet());
        final EdgeType fetchType = t.rule.fetchType(t.depth);
        final List<CompletableFuture<List<Relationship>>> lookups = new ArrayList<>(nodes.size());
        for (String node : nodes) {
            lookups.add(lookup(node, fetchType));
        }
        t.entitiesVisited += nodes.size();
        logger.debug("Expanding {} entities at depth {} for {}", nodes.size(), t.depth, t.question);

        CompletableFuture.allOf(lookups.toArray(new CompletableFuture[0]))
            .orTimeout(remainingNanos, TimeUnit.NANOSECONDS)
            .whenComplete((ignored, failure) -> {
                if (failure != null) {
                    abort(t, failure);
                    return;
                }
                List<List<Relationship>> edges = new ArrayList<>(lookups.size());
                for (CompletableFuture<List<Relationship>> lookup : lookups) {
                    edges.add(lookup.join());
                }
                try {
                    processLevel(t, nodes, edges);
                } catch (RuntimeException e) {
                    logger.warn("Traversal for {} failed while processing depth {}: {}", t.question, t.depth, e.getMessage());
                    t.finish(QueryResult.unknown(UnknownReason.STORAGE_ERROR, t.entitiesVisited));
                }
            });
    }

    private CompletableFuture<List<Relationship>> lookup(String node, EdgeType fetchType) {
        try {
            return storage.getRelationshipsByHead(node, fetchType);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void processLevel(Traversal t, List<String> nodes, List<List<Relationship>> edgesPerNode) {
        final EdgeType goalType = t.rule.goalType(t.depth);
        final EdgeType stepType = t.rule.stepType(t.depth);
        final String target = t.question.object();

        TraversalPath bestGoal = null;
        TreeMap<String, TraversalPath> next = new TreeMap<>();

        for (int i = 0; i < nodes.size(); i++) {
            TraversalPath pathToNode = t.frontier.get(nodes.get(i));
            for (Relationship edge : edgesPerNode.get(i)) {
                if (edge.getConfidence() <= 0.0) {
                    continue;
                }
                if (edge.getEdgeType() == goalType && edge.getTailEntity().equals(target)) {
                    TraversalPath candidate = pathToNode.extend(edge);
                    if (bestGoal == null || candidate.isBetterThan(bestGoal)) {
                        bestGoal = candidate;
                    }
                }
                if (edge.getEdgeType() == stepType && !t.visited.contains(edge.getTailEntity())) {
                    TraversalPath candidate = pathToNode.extend(edge);
                    TraversalPath existing = next.get(edge.getTailEntity());
                    if (existing == null || candidate.isBetterThan(existing)) {
                        next.put(edge.getTailEntity(), candidate);
                    }
                }
            }
        }

        if (bestGoal != null) {
            t.finish(QueryResult.yes(bestGoal.edges(), bestGoal.confidence(), t.entitiesVisited));
            return;
        }

        t.visited.addAll(next.keySet());
        t.frontier = next;
        t.depth++;
        expandLevel(t);
    }

    private void abort(Traversal t, Throwable failure) {
        Throwable cause = TransientFailurePredicate.unwrap(failure);
        if (cause instanceof CancellationException) {
            t.result.cancel(false);
            return;
        }
        UnknownReason reason;
        if (cause instanceof CircuitBreakerOpenException) {
            reason = UnknownReason.BREAKER_OPEN;
        } else if (cause instanceof TimeoutException) {
            reason = UnknownReason.TIMEOUT;
        } else if (transientFailure.test(cause)) {
            reason = UnknownReason.BACKEND_UNAVAILABLE;
        } else {
            reason = UnknownReason.STORAGE_ERROR;
        }
        logger.debug("Traversal for {} aborted at depth {}: {} ({})",
            t.question, t.depth, reason, cause.getMessage());
        t.finish(QueryResult.unknown(reason, t.entitiesVisited));
    }

    /**
     * Mutable state of one traversal. Levels run one after another, so no field is
     * touched concurrently.
     */
    private static final class Traversal {
        final Question question;
        final TraversalRule rule;
        final long startNanos;
        final CompletableFuture<QueryResult> result = new CompletableFuture<>();
        final Set<String> visited = new HashSet<>();
        TreeMap<String, TraversalPath> frontier = new TreeMap<>();
        int depth;
        int entitiesVisited;

        Traversal(Question question, TraversalRule rule, long startNanos) {
            this.question = question;
            this.rule = rule;
            this.startNanos = startNanos;
            visited.add(question.subject());
            frontier.put(question.subject(), TraversalPath.startingAt(question.subject()));
        }

        void finish(QueryResult outcome) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            if (result.complete(outcome.withElapsed(elapsed))) {
                logger.debug("{} -> {} (confidence={}, visited={}, depth={})",
                    question, outcome.outcome(), outcome.confidence(), outcome.entitiesVisited(), depth);
            }
        }
    }
}
