package br.edu.ifba.ontology.core;

/**
 * Answer of a typed question.
 */
public enum QueryOutcome {
    /**
     * A path proving the relation was found.
     */
    YES,

    /**
     * The search space was exhausted without finding a path.
     */
    NO,

    /**
     * The search could not complete, see {@link UnknownReason}.
     */
    UNKNOWN
}
