package br.edu.ifba.ontology.cache;

import br.edu.ifba.ontology.core.QueryResult;
import br.edu.ifba.ontology.ingestion.BatchCommitListener;
import br.edu.ifba.ontology.metrics.MetricNames;
import br.edu.ifba.ontology.metrics.MetricsSink;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded answer cache combining time-based expiry with least-recently-used eviction.
 *
 * <p>Entries live in an access-ordered {@link LinkedHashMap}, so iteration order is
 * LRU first. Every {@code get} and {@code put} refreshes {@code lastAccessed}. An entry
 * found past its expiry on {@code get} is removed and reported as a miss. A
 * {@code put} at capacity first drops expired entries, then the least recently
 * accessed one.</p>
 *
 * <p>The map is guarded by a {@link ReentrantLock} held only for in-memory work.
 * Hits, misses, evictions (tagged {@code cause=ttl|lru}) and invalidations are
 * reported to the {@link MetricsSink}.</p>
 *
 * <p>As a {@link BatchCommitListener} the cache clears itself whenever ingestion
 * commits a batch: any new edge may change any answer.</p>
 */
public final class ResultCache implements BatchCommitListener {

    private static final Logger logger = LoggerFactory.getLogger(ResultCache.class);

    /**
     * Cache sizing.
     *
     * @param capacity maximum number of entries
     * @param defaultTtl lifetime used by {@link #put(CacheKey, QueryResult)}
     */
    public record Settings(int capacity, @NotNull Duration defaultTtl) {
        public Settings {
            if (capacity < 1) {
                throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
            }
            Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
            if (defaultTtl.isNegative() || defaultTtl.isZero()) {
                throw new IllegalArgumentException("defaultTtl must be positive");
            }
        }
    }

    private final Settings settings;
    private final Clock clock;
    private final MetricsSink metrics;

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private final LinkedHashMap<CacheKey, CacheEntry> entries;

    // guarded by lock; bumped by every invalidation
    private long generation;

    public ResultCache(@NotNull Settings settings, @NotNull Clock clock, @NotNull MetricsSink metrics) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * Looks up a cached answer.
     *
     * @param key normalized question key
     * @return the cached value, or empty on miss or expiry
     */
    @NotNull
    public Optional<QueryResult> get(@NotNull CacheKey key) {
        Objects.requireNonNull(key, "key must not be null");
        Instant now = clock.instant();
        CacheEntry entry;
        boolean expired = false;
        int size;
        lock.lock();
        try {
            entry = entries.get(key);
            if (entry != null && entry.isExpired(now)) {
                entries.remove(key);
                expired = true;
                entry = null;
            } else if (entry != null) {
                entry = entry.touch(now);
                entries.put(key, entry);
            }
            size = entries.size();
        } finally {
            lock.unlock();
        }

        if (expired) {
            metrics.increment(MetricNames.CACHE_EVICTION, Map.of("cause", "ttl"));
            metrics.gauge(MetricNames.CACHE_SIZE, size);
        }
        if (entry == null) {
            logger.debug("Result cache MISS for {}", key);
            metrics.increment(MetricNames.CACHE_MISS);
            return Optional.empty();
        }
        logger.debug("Result cache HIT for {}", key);
        metrics.increment(MetricNames.CACHE_HIT);
        return Optional.of(entry.value());
    }

    /**
     * Current invalidation generation. Capture it before computing an answer and hand
     * it to {@link #putIfCurrent} so that an answer computed against data that has
     * since been invalidated is not stored.
     */
    public long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores an answer with the default TTL unless the cache was invalidated after
     * {@code generation} was read.
     *
     * @return true if the answer was stored
     */
    public boolean putIfCurrent(@NotNull CacheKey key, @NotNull QueryResult value, long generation) {
        return store(key, value, settings.defaultTtl(), generation);
    }

    /**
     * Stores an answer with the default TTL.
     */
    public void put(@NotNull CacheKey key, @NotNull QueryResult value) {
        put(key, value, settings.defaultTtl());
    }

    /**
     * Stores an answer, replacing any previous value for the key.
     *
     * @param key normalized question key
     * @param value the answer
     * @param ttl entry lifetime, must be positive
     */
    public void put(@NotNull CacheKey key, @NotNull QueryResult value, @NotNull Duration ttl) {
        store(key, value, ttl, -1);
    }

    // a negative generation stores unconditionally
    private boolean store(CacheKey key, QueryResult value, Duration ttl, long expectedGeneration) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        Instant now = clock.instant();
        int expiredEvictions = 0;
        int lruEvictions = 0;
        int size;
        lock.lock();
        try {
            if (expectedGeneration >= 0 && expectedGeneration != generation) {
                logger.debug("Dropping answer for {} computed before an invalidation", key);
                return false;
            }
            if (!entries.containsKey(key) && entries.size() >= settings.capacity()) {
                expiredEvictions = purgeExpired(now);
                while (entries.size() >= settings.capacity()) {
                    Iterator<CacheKey> eldest = entries.keySet().iterator();
                    eldest.next();
                    eldest.remove();
                    lruEvictions++;
                }
            }
            entries.put(key, new CacheEntry(key, value, now, now.plus(ttl), now));
            size = entries.size();
        } finally {
            lock.unlock();
        }

        for (int i = 0; i < expiredEvictions; i++) {
            metrics.increment(MetricNames.CACHE_EVICTION, Map.of("cause", "ttl"));
        }
        for (int i = 0; i < lruEvictions; i++) {
            metrics.increment(MetricNames.CACHE_EVICTION, Map.of("cause", "lru"));
        }
        metrics.gauge(MetricNames.CACHE_SIZE, size);
        return true;
    }

    /**
     * Removes every entry. Answers still being computed against the old data will
     * not be stored.
     *
     * @return number of entries removed
     */
    public int invalidateAll() {
        int removed;
        lock.lock();
        try {
            removed = entries.size();
            entries.clear();
            generation++;
        } finally {
            lock.unlock();
        }
        metrics.increment(MetricNames.CACHE_INVALIDATION, Map.of("scope", "all"));
        metrics.gauge(MetricNames.CACHE_SIZE, 0);
        logger.debug("Invalidated {} cached answers", removed);
        return removed;
    }

    /**
     * Removes the given keys. Like {@link #invalidateAll()} this also discards answers
     * still being computed.
     *
     * @return number of entries actually removed
     */
    public int invalidate(@NotNull Collection<CacheKey> keys) {
        Objects.requireNonNull(keys, "keys must not be null");
        int removed = 0;
        int size;
        lock.lock();
        try {
            generation++;
            for (CacheKey key : keys) {
                if (entries.remove(key) != null) {
                    removed++;
                }
            }
            size = entries.size();
        } finally {
            lock.unlock();
        }
        metrics.increment(MetricNames.CACHE_INVALIDATION, Map.of("scope", "keys"));
        metrics.gauge(MetricNames.CACHE_SIZE, size);
        return removed;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onBatchCommitted(int entities, int relationships) {
        int removed = invalidateAll();
        logger.debug("Batch of {} entities / {} relationships committed, dropped {} cached answers",
            entities, relationships, removed);
    }

    // caller holds lock
    private int purgeExpired(Instant now) {
        int purged = 0;
        Iterator<CacheEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                purged++;
            }
        }
        return purged;
    }
}
