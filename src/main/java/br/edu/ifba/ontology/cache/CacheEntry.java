package br.edu.ifba.ontology.cache;

import br.edu.ifba.ontology.core.QueryResult;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;

/**
 * One cached answer with its timing bookkeeping.
 */
public record CacheEntry(
        @NotNull CacheKey key,
        @NotNull QueryResult value,
        @NotNull Instant insertedAt,
        @NotNull Instant expiresAt,
        @NotNull Instant lastAccessed
) {
    public boolean isExpired(@NotNull Instant now) {
        return !now.isBefore(expiresAt);
    }

    @NotNull
    public CacheEntry touch(@NotNull Instant now) {
        return new CacheEntry(key, value, insertedAt, expiresAt, now);
    }
}
