package br.edu.ifba.ontology.metrics;

import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Emission contract for metrics.
 *
 * <p>Implementations must never block the caller for long and must never throw:
 * a metrics backend problem is not allowed to fail a query or an ingestion batch.</p>
 */
public interface MetricsSink {

    /**
     * Sink that drops everything.
     */
    MetricsSink NOOP = new MetricsSink() {
        @Override
        public void increment(@NotNull String name, @NotNull Map<String, String> tags) {
        }

        @Override
        public void observe(@NotNull String name, double value, @NotNull Map<String, String> tags) {
        }

        @Override
        public void gauge(@NotNull String name, double value, @NotNull Map<String, String> tags) {
        }
    };

    void increment(@NotNull String name, @NotNull Map<String, String> tags);

    void observe(@NotNull String name, double value, @NotNull Map<String, String> tags);

    void gauge(@NotNull String name, double value, @NotNull Map<String, String> tags);

    default void increment(@NotNull String name) {
        increment(name, Map.of());
    }

    default void observe(@NotNull String name, double value) {
        observe(name, value, Map.of());
    }

    default void gauge(@NotNull String name, double value) {
        gauge(name, value, Map.of());
    }
}
