package br.edu.ifba.ontology.ingestion;

import org.jetbrains.annotations.NotNull;

/**
 * Raised when a raw record cannot be turned into an entity or relationship.
 * The record is skipped and counted; the batch continues.
 */
public class RecordValidationException extends Exception {

    private final transient RawRecord record;
    private final String field;

    public RecordValidationException(@NotNull RawRecord record, @NotNull String field, @NotNull String message) {
        super(message + " [field=" + field + ", source=" + record.source() + "]");
        this.record = record;
        this.field = field;
    }

    @NotNull
    public RawRecord getRecord() {
        return record;
    }

    @NotNull
    public String getField() {
        return field;
    }
}
