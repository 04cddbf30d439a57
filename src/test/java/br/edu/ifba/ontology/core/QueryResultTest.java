package br.edu.ifba.ontology.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the {@link QueryResult} invariants.
 */
class QueryResultTest {

    private static final Relationship EDGE = new Relationship("dog", "animal", EdgeType.SUBCLASS_OF, 0.9);

    @Nested
    @DisplayName("Factories")
    class Factories {

        @Test
        @DisplayName("yes carries path and confidence")
        void testYes() {
            QueryResult result = QueryResult.yes(List.of(EDGE), 0.9, 2);
            assertEquals(QueryOutcome.YES, result.outcome());
            assertEquals(List.of(EDGE), result.path());
            assertNull(result.reason());
            assertFalse(result.cacheHit());
        }

        @Test
        @DisplayName("unknown with DEPTH_EXCEEDED sets maxDepthExceeded")
        void testDepthExceeded() {
            QueryResult result = QueryResult.unknown(UnknownReason.DEPTH_EXCEEDED, 7);
            assertTrue(result.maxDepthExceeded());
            assertEquals(UnknownReason.DEPTH_EXCEEDED, result.reason());
        }

        @Test
        @DisplayName("unknown for backend problems does not claim the depth limit")
        void testBreakerOpen() {
            QueryResult result = QueryResult.unknown(UnknownReason.BREAKER_OPEN, 0);
            assertFalse(result.maxDepthExceeded());
            assertEquals(0.0, result.confidence());
            assertTrue(result.path().isEmpty());
        }

        @Test
        @DisplayName("withCacheHit and withElapsed change nothing else")
        void testCopies() {
            QueryResult original = QueryResult.yes(List.of(EDGE), 0.9, 2);
            QueryResult copy = original.withCacheHit(true).withElapsed(Duration.ofMillis(3));
            assertTrue(copy.cacheHit());
            assertEquals(Duration.ofMillis(3), copy.elapsed());
            assertEquals(original.path(), copy.path());
            assertEquals(original.confidence(), copy.confidence());
        }
    }

    @Nested
    @DisplayName("Invariants")
    class Invariants {

        @Test
        @DisplayName("YES needs a non-empty path")
        void testYesNeedsPath() {
            assertThrows(IllegalArgumentException.class, () -> QueryResult.yes(List.of(), 0.5, 1));
        }

        @Test
        @DisplayName("YES needs positive confidence")
        void testYesNeedsConfidence() {
            assertThrows(IllegalArgumentException.class, () -> QueryResult.yes(List.of(EDGE), 0.0, 1));
        }

        @Test
        @DisplayName("confidence must be within [0, 1]")
        void testConfidenceRange() {
            assertThrows(IllegalArgumentException.class, () -> QueryResult.yes(List.of(EDGE), 1.5, 1));
            assertThrows(IllegalArgumentException.class, () -> QueryResult.yes(List.of(EDGE), Double.NaN, 1));
        }

        @Test
        @DisplayName("NO cannot have exceeded the depth limit")
        void testNoWithDepthExceeded() {
            assertThrows(IllegalArgumentException.class, () -> new QueryResult(
                QueryOutcome.NO, 0.0, List.of(), 1, true, false, Duration.ZERO, null));
        }

        @Test
        @DisplayName("UNKNOWN requires a reason and only UNKNOWN may carry one")
        void testReasonOnlyForUnknown() {
            assertThrows(IllegalArgumentException.class, () -> new QueryResult(
                QueryOutcome.UNKNOWN, 0.0, List.of(), 1, false, false, Duration.ZERO, null));
            assertThrows(IllegalArgumentException.class, () -> new QueryResult(
                QueryOutcome.NO, 0.0, List.of(), 1, false, false, Duration.ZERO, UnknownReason.TIMEOUT));
        }

        @Test
        @DisplayName("later changes to the source path list do not leak in")
        void testPathCopied() {
            QueryResult result = QueryResult.yes(new java.util.ArrayList<>(List.of(EDGE)), 0.9, 1);
            assertThrows(UnsupportedOperationException.class, () -> result.path().add(EDGE));
        }
    }

    @Test
    @DisplayName("only depth-limited UNKNOWN is deterministic")
    void testDeterministicReasons() {
        for (UnknownReason reason : UnknownReason.values()) {
            assertEquals(reason == UnknownReason.DEPTH_EXCEEDED, reason.isDeterministic(), reason.name());
        }
    }
}
