package com.marketlevels.marketdata.cache;

import java.time.Instant;

/**
 * Immutable cache entry. An entry is live while {@code now < expiresAt}; it is
 * superseded by the next successful fetch, never updated in place.
 */
public record CacheEntry<T>(
    String  key,
    T       data,
    Instant createdAt,
    Instant expiresAt
) {
    public boolean isLive(Instant now) {
        return now.isBefore(expiresAt);
    }
}
