package br.edu.ifba.ontology.storage;

/**
 * Health of a storage backend.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    DOWN
}
