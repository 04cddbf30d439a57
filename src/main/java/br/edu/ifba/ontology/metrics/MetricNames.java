package br.edu.ifba.ontology.metrics;

/**
 * Metric names emitted by the reasoner. Tags are documented next to each name.
 */
public final class MetricNames {

    public static final String CACHE_HIT = "ontology.cache.hit";
    public static final String CACHE_MISS = "ontology.cache.miss";
    /** tag {@code cause}: ttl | lru */
    public static final String CACHE_EVICTION = "ontology.cache.eviction";
    public static final String CACHE_INVALIDATION = "ontology.cache.invalidation";
    public static final String CACHE_SIZE = "ontology.cache.size";

    /** tag {@code state}: target breaker state */
    public static final String BREAKER_TRANSITION = "ontology.breaker.transition";
    /** tag {@code operation} */
    public static final String BREAKER_REJECTED = "ontology.breaker.rejected";

    /** tags {@code operation}, {@code outcome}: success | failure | rejected */
    public static final String STORAGE_LATENCY = "ontology.storage.latency";

    /** tags {@code type}, {@code outcome} */
    public static final String QUERY_LATENCY = "ontology.query.latency";
    /** tags {@code type}, {@code outcome}, {@code cache_hit} */
    public static final String QUERY_TOTAL = "ontology.query.total";
    public static final String QUERY_ENTITIES_VISITED = "ontology.query.entities_visited";

    /** tag {@code kind}: entity | relationship */
    public static final String INGESTION_ACCEPTED = "ontology.ingestion.accepted";
    /** tag {@code kind}: entity | relationship */
    public static final String INGESTION_REJECTED = "ontology.ingestion.rejected";
    public static final String INGESTION_BATCH_COMMITTED = "ontology.ingestion.batch.committed";
    public static final String INGESTION_BATCH_FAILED = "ontology.ingestion.batch.failed";
    public static final String INGESTION_BATCH_SIZE = "ontology.ingestion.batch.size";

    private MetricNames() {
        throw new UnsupportedOperationException("Utility class");
    }
}
