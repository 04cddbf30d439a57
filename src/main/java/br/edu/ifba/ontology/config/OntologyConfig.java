package br.edu.ifba.ontology.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for the ontology reasoner.
 *
 * All properties are read from application.properties with the prefix "ontology".
 */
@ConfigMapping(prefix = "ontology")
public interface OntologyConfig {

    Query query();

    Cache cache();

    Breaker breaker();

    Ingestion ingestion();

    Executor executor();

    /**
     * Validates configuration at startup.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        if (query().maxDepth() < 1) {
            throw new IllegalArgumentException(
                String.format("ontology.query.max-depth must be >= 1, got %d", query().maxDepth()));
        }
        if (breaker().resetTimeout().isNegative()) {
            throw new IllegalArgumentException("ontology.breaker.reset-timeout must not be negative");
        }

        Map<String, Integer> sizes = new LinkedHashMap<>();
        sizes.put("ontology.cache.capacity", cache().capacity());
        sizes.put("ontology.breaker.failure-threshold", breaker().failureThreshold());
        sizes.put("ontology.ingestion.batch-size", ingestion().batchSize());
        sizes.put("ontology.ingestion.workers", ingestion().workers());
        sizes.put("ontology.ingestion.queue-depth", ingestion().queueDepth());
        sizes.put("ontology.executor.threads", executor().threads());
        sizes.forEach((key, value) -> {
            if (value < 1) {
                throw new IllegalArgumentException(String.format("%s must be positive, got %d", key, value));
            }
        });

        Map<String, Duration> durations = new LinkedHashMap<>();
        durations.put("ontology.query.timeout", query().timeout());
        durations.put("ontology.cache.ttl", cache().ttl());
        durations.put("ontology.breaker.call-timeout", breaker().callTimeout());
        durations.put("ontology.ingestion.flush-interval", ingestion().flushInterval());
        durations.forEach((key, value) -> {
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(String.format("%s must be positive, got %s", key, value));
            }
        });
    }

    interface Query {
        /**
         * Maximum number of edges in an answer path.
         */
        @WithDefault("10")
        int maxDepth();

        /**
         * Wall-clock budget of one traversal.
         */
        @WithDefault("PT5S")
        Duration timeout();

        /**
         * Answer UNKNOWN / ENTITY_NOT_FOUND when the subject is not stored.
         */
        @WithDefault("false")
        boolean validateEntities();
    }

    interface Cache {
        @WithDefault("10000")
        int capacity();

        @WithDefault("PT10M")
        Duration ttl();
    }

    interface Breaker {
        /**
         * Size of the rolling request window. The breaker opens when every call in it failed transiently.
         */
        @WithDefault("5")
        int failureThreshold();

        /**
         * Longest a single guarded storage call may run before it fails as a timeout.
         */
        @WithDefault("PT3S")
        Duration callTimeout();

        /**
         * Time spent OPEN before a trial call is admitted.
         */
        @WithDefault("PT30S")
        Duration resetTimeout();
    }

    interface Ingestion {
        @WithDefault("500")
        int batchSize();

        @WithDefault("PT2S")
        Duration flushInterval();

        @WithDefault("4")
        int workers();

        /**
         * Raw batches buffered between the source and the workers.
         */
        @WithDefault("16")
        int queueDepth();
    }

    interface Executor {
        /**
         * Threads of the pool shared by the storage backend.
         */
        @WithDefault("8")
        int threads();
    }
}
