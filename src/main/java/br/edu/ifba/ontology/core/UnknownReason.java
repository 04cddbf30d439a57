package br.edu.ifba.ontology.core;

/**
 * Why a query resolved to {@link QueryOutcome#UNKNOWN}.
 */
public enum UnknownReason {
    /** The frontier was still non-empty when the depth limit was reached. */
    DEPTH_EXCEEDED,
    /** The traversal ran past its wall-clock budget. */
    TIMEOUT,
    /** The circuit breaker rejected a storage call without attempting it. */
    BREAKER_OPEN,
    /** A transient storage failure aborted the traversal. */
    BACKEND_UNAVAILABLE,
    /** A permanent storage failure aborted the traversal. */
    STORAGE_ERROR,
    /** The subject entity does not exist (only when entity validation is enabled). */
    ENTITY_NOT_FOUND;

    /**
     * Whether a result carrying this reason only depends on the graph contents, and
     * may therefore be cached like YES and NO answers.
     */
    public boolean isDeterministic() {
        return this == DEPTH_EXCEEDED;
    }
}
