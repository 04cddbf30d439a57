package br.edu.ifba.ontology.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Scored answer to a {@link Question}.
 *
 * <p>The compact constructor enforces the result invariants: confidence in [0, 1];
 * YES carries a non-empty path and positive confidence; NO never has
 * {@code maxDepthExceeded}; UNKNOWN always carries a reason and only UNKNOWN does.</p>
 *
 * @param outcome YES, NO or UNKNOWN
 * @param confidence product of the edge confidences along {@code path}
 * @param path relationships used, in traversal order (empty unless YES)
 * @param entitiesVisited number of entities expanded by the traversal
 * @param maxDepthExceeded true when the depth limit stopped the search
 * @param cacheHit true when the value was served from the result cache
 * @param elapsed time spent answering
 * @param reason set for UNKNOWN outcomes only
 */
public record QueryResult(
        @NotNull QueryOutcome outcome,
        double confidence,
        @NotNull List<Relationship> path,
        int entitiesVisited,
        boolean maxDepthExceeded,
        boolean cacheHit,
        @NotNull Duration elapsed,
        @Nullable UnknownReason reason
) {
    public QueryResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
        path = List.copyOf(path);
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        if (outcome == QueryOutcome.YES && (path.isEmpty() || confidence <= 0.0)) {
            throw new IllegalArgumentException("YES requires a non-empty path and positive confidence");
        }
        if (outcome == QueryOutcome.NO && maxDepthExceeded) {
            throw new IllegalArgumentException("NO cannot be reported when the depth limit was exceeded");
        }
        if ((outcome == QueryOutcome.UNKNOWN) != (reason != null)) {
            throw new IllegalArgumentException("reason must be set for UNKNOWN and only for UNKNOWN");
        }
        if (maxDepthExceeded && reason != UnknownReason.DEPTH_EXCEEDED) {
            throw new IllegalArgumentException("maxDepthExceeded requires reason DEPTH_EXCEEDED");
        }
    }

    public static QueryResult yes(@NotNull List<Relationship> path, double confidence, int entitiesVisited) {
        return new QueryResult(QueryOutcome.YES, confidence, path, entitiesVisited, false, false, Duration.ZERO, null);
    }

    public static QueryResult no(int entitiesVisited) {
        return new QueryResult(QueryOutcome.NO, 0.0, List.of(), entitiesVisited, false, false, Duration.ZERO, null);
    }

    public static QueryResult unknown(@NotNull UnknownReason reason, int entitiesVisited) {
        return new QueryResult(QueryOutcome.UNKNOWN, 0.0, List.of(), entitiesVisited,
            reason == UnknownReason.DEPTH_EXCEEDED, false, Duration.ZERO, reason);
    }

    @NotNull
    public QueryResult withCacheHit(boolean hit) {
        return new QueryResult(outcome, confidence, path, entitiesVisited, maxDepthExceeded, hit, elapsed, reason);
    }

    @NotNull
    public QueryResult withElapsed(@NotNull Duration newElapsed) {
        return new QueryResult(outcome, confidence, path, entitiesVisited, maxDepthExceeded, cacheHit, newElapsed, reason);
    }
}
