package br.edu.ifba.ontology.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(10)
class QueueRecordSourceTest {

    private static List<RawRecord> batch(String head) {
        return List.of(RawRecord.relationship(head, "animal", "SubclassOf", "1.0"));
    }

    @Test
    @DisplayName("batches come out in offer order and iteration ends after close")
    void testOrderAndClose() throws InterruptedException {
        QueueRecordSource source = new QueueRecordSource(4);
        source.offer(batch("dog"));
        source.offer(batch("cat"));
        source.close();

        Iterator<List<RawRecord>> batches = source.batches();
        assertEquals("dog", batches.next().get(0).field(RawRecord.HEAD_ENTITY));
        assertEquals("cat", batches.next().get(0).field(RawRecord.HEAD_ENTITY));
        assertFalse(batches.hasNext());
    }

    @Test
    @DisplayName("offers after close are refused")
    void testOfferAfterClose() {
        QueueRecordSource source = new QueueRecordSource(1);
        source.close();
        source.close();

        assertTrue(source.isClosed());
        assertThrows(IllegalStateException.class, () -> source.offer(batch("dog")));
        assertEquals(0, source.pending());
    }

    @Test
    @DisplayName("a full source blocks the offering thread until a batch is taken")
    void testBackpressure() throws Exception {
        QueueRecordSource source = new QueueRecordSource(1);
        source.offer(batch("dog"));

        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<Void> blocked = CompletableFuture.runAsync(() -> {
            started.countDown();
            try {
                source.offer(batch("cat"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });
        assertTrue(started.await(1, TimeUnit.SECONDS));
        Thread.sleep(200);
        assertFalse(blocked.isDone());
        assertEquals(1, source.pending());

        Iterator<List<RawRecord>> batches = source.batches();
        batches.next();
        blocked.get(2, TimeUnit.SECONDS);
        assertEquals(1, source.pending());
    }

    @Test
    @DisplayName("a blocked offer fails once the source is closed")
    void testCloseReleasesBlockedOffer() throws Exception {
        QueueRecordSource source = new QueueRecordSource(1);
        source.offer(batch("dog"));

        CompletableFuture<Void> blocked = CompletableFuture.runAsync(() -> {
            try {
                source.offer(batch("cat"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);
        source.close();

        Exception e = assertThrows(Exception.class, () -> blocked.get(2, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
