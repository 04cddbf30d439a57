package br.edu.ifba.ontology.ingestion;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Open-ended record source fed by other threads.
 *
 * <p>Producers call {@link #offer}, which blocks while {@code capacity} batches are
 * waiting to be consumed. The pipeline's iterator blocks until a batch arrives. After
 * {@link #close()} further offers are refused and iteration ends once the batches
 * queued before the close are drained.</p>
 */
public class QueueRecordSource implements RecordSource {

    private static final List<RawRecord> END = new ArrayList<>();
    private static final long CLOSE_CHECK_MILLIS = 50;

    private final BlockingQueue<List<RawRecord>> queue = new LinkedBlockingQueue<>();
    private final Semaphore slots;
    private final Object lock = new Object();

    // guarded by lock
    private boolean closed;

    public QueueRecordSource(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.slots = new Semaphore(capacity);
    }

    /**
     * Hands a batch to the pipeline, waiting while the source is full.
     *
     * @throws IllegalStateException if the source is closed
     * @throws InterruptedException if interrupted while waiting
     */
    public void offer(@NotNull List<RawRecord> batch) throws InterruptedException {
        List<RawRecord> copy = List.copyOf(Objects.requireNonNull(batch, "batch must not be null"));
        while (!slots.tryAcquire(CLOSE_CHECK_MILLIS, TimeUnit.MILLISECONDS)) {
            ensureOpen();
        }
        synchronized (lock) {
            if (closed) {
                slots.release();
                throw new IllegalStateException("Record source is closed");
            }
            queue.add(copy);
        }
    }

    /**
     * @return batches offered but not yet consumed
     */
    public int pending() {
        synchronized (lock) {
            return closed ? Math.max(0, queue.size() - 1) : queue.size();
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    @NotNull
    @Override
    public Iterator<List<RawRecord>> batches() {
        return new Iterator<>() {
            private List<RawRecord> next;
            private boolean ended;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (ended) {
                    return false;
                }
                try {
                    List<RawRecord> taken = queue.take();
                    if (taken == END) {
                        ended = true;
                        return false;
                    }
                    slots.release();
                    next = taken;
                    return true;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    ended = true;
                    return false;
                }
            }

            @Override
            public List<RawRecord> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                List<RawRecord> batch = next;
                next = null;
                return batch;
            }
        };
    }

    /**
     * Ends the stream after the batches already queued. Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (!closed) {
                closed = true;
                queue.add(END);
            }
        }
    }

    private void ensureOpen() {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Record source is closed");
            }
        }
    }
}
