package br.edu.ifba.ontology.ingestion;

import java.util.Locale;

/**
 * Kind of a raw ingestion record.
 */
public enum RecordKind {
    ENTITY,
    RELATIONSHIP;

    /**
     * @return lower-case form used as a metric tag
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
