package br.edu.ifba.ontology.ingestion;

import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Lazy, possibly unbounded sequence of raw-record batches.
 *
 * <p>The pipeline pulls one batch at a time from a single thread, so implementations
 * need not be thread-safe for iteration. {@code hasNext} may block until input is
 * available; a source ends when {@code hasNext} returns false. Read failures surface
 * as unchecked exceptions from the iterator.</p>
 */
public interface RecordSource extends AutoCloseable {

    @NotNull
    Iterator<List<RawRecord>> batches();

    /**
     * Releases the underlying input. Does not throw checked exceptions.
     */
    @Override
    default void close() {
    }

    /**
     * @return a source over batches already in memory
     */
    static RecordSource of(@NotNull Iterable<List<RawRecord>> batches) {
        Objects.requireNonNull(batches, "batches must not be null");
        return batches::iterator;
    }
}
