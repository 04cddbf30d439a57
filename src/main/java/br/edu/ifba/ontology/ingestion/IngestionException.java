package br.edu.ifba.ontology.ingestion;

import org.jetbrains.annotations.NotNull;

/**
 * Batch-level ingestion failure. Carries what was committed before the run stopped,
 * so the caller can decide to retry or abort.
 */
public class IngestionException extends RuntimeException {

    private final IngestionReport partialReport;

    public IngestionException(@NotNull String message, @NotNull Throwable cause, @NotNull IngestionReport partialReport) {
        super(message, cause);
        this.partialReport = partialReport;
    }

    @NotNull
    public IngestionReport getPartialReport() {
        return partialReport;
    }
}
