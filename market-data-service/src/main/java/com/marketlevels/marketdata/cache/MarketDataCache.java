package com.marketlevels.marketdata.cache;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * In-memory TTL cache shared by every fetch path, with request coalescing.
 *
 * <p><strong>Fetch Once → Serve Many:</strong>
 * <ol>
 *   <li>Live entry for the key → returned without calling the fetch function.</li>
 *   <li>Fetch already in flight for the key → the caller joins it.</li>
 *   <li>Otherwise a {@link PendingRequest} is registered and the fetch function is
 *       subscribed once. Success stores an entry expiring after the category TTL;
 *       failure is propagated to every waiter and nothing is cached.</li>
 * </ol>
 * The pending registration is dropped as soon as the fetch settles, whatever the outcome.
 * A waiter that cancels does not cancel the upstream fetch.
 *
 * <p>Both maps are guarded by one monitor; no I/O happens while it is held.
 * When the store reaches {@code maxSize}, expired entries are purged first, then the
 * oldest-inserted 20% are evicted.
 */
@Component
public class MarketDataCache {

    private static final Logger log = LoggerFactory.getLogger(MarketDataCache.class);

    private static final double EVICTION_FRACTION = 0.2;

    private final Object lock = new Object();
    private final LinkedHashMap<String, CacheEntry<?>> store   = new LinkedHashMap<>();
    private final Map<String, PendingRequest<?>>       pending = new HashMap<>();

    private final Clock clock;
    private final int   maxSize;

    public MarketDataCache(Clock clock, @Value("${market-data.cache.max-size:1000}") int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("market-data.cache.max-size must be positive: " + maxSize);
        }
        this.clock   = clock;
        this.maxSize = maxSize;
    }

    /** Same as {@link #getOrFetch(String, CacheCategory, Supplier)} with {@link CacheCategory#DEFAULT}. */
    public <T> Mono<T> getOrFetch(String key, Supplier<? extends Mono<? extends T>> fetchFn) {
        return getOrFetch(key, CacheCategory.DEFAULT, fetchFn);
    }

    @SuppressWarnings("unchecked")
    public <T> Mono<T> getOrFetch(String key, CacheCategory category,
                                  Supplier<? extends Mono<? extends T>> fetchFn) {
        return Mono.defer(() -> {
            PendingRequest<T> request;
            synchronized (lock) {
                CacheEntry<?> entry = store.get(key);
                if (entry != null) {
                    if (entry.isLive(clock.instant())) {
                        log.debug("CACHE_HIT key={} expiresAt={}", key, entry.expiresAt());
                        return Mono.just((T) entry.data());
                    }
                    store.remove(key);
                }

                PendingRequest<?> inFlight = pending.get(key);
                if (inFlight != null) {
                    log.debug("CACHE_JOIN key={}", key);
                    return ((PendingRequest<T>) inFlight).result();
                }

                request = new PendingRequest<>(key);
                pending.put(key, request);
            }

            log.debug("CACHE_MISS key={} category={}", key, category);
            start(request, category, fetchFn);
            return request.result();
        });
    }

    /** Removes the entry for {@code key}; an in-flight fetch for it is left alone. */
    public void evict(String key) {
        synchronized (lock) {
            store.remove(key);
        }
    }

    /** Drops every stored entry. In-flight fetches still complete and repopulate. */
    public void clear() {
        synchronized (lock) {
            store.clear();
        }
        log.info("CACHE_CLEARED");
    }

    public int size() {
        synchronized (lock) {
            return store.size();
        }
    }

    int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    boolean contains(String key) {
        synchronized (lock) {
            CacheEntry<?> entry = store.get(key);
            return entry != null && entry.isLive(clock.instant());
        }
    }

    @PreDestroy
    void shutdown() {
        clear();
    }

    // ── fetch lifecycle ─────────────────────────────────────────────────────

    private <T> void start(PendingRequest<T> request, CacheCategory category,
                           Supplier<? extends Mono<? extends T>> fetchFn) {
        Mono.<T>defer(fetchFn).subscribe(
            value -> {
                promote(request, category, value);
                request.succeed(value);
            },
            error -> {
                release(request);
                log.debug("CACHE_FETCH_FAILED key={} reason={}", request.key(), error.getMessage());
                request.fail(error);
            },
            () -> {
                if (release(request)) {
                    log.debug("CACHE_FETCH_EMPTY key={}", request.key());
                    request.completeEmpty();
                }
            });
    }

    private <T> void promote(PendingRequest<T> request, CacheCategory category, T value) {
        String  key = request.key();
        Instant now = clock.instant();
        synchronized (lock) {
            pending.remove(key, request);
            store.remove(key);
            if (store.size() >= maxSize) {
                cleanup(now);
            }
            store.put(key, new CacheEntry<>(key, value, now, now.plus(category.ttl())));
        }
        log.info("CACHE_REFRESH key={} category={} ttlSeconds={}", key, category, category.ttl().toSeconds());
    }

    /** @return {@code true} if this call removed the registration */
    private boolean release(PendingRequest<?> request) {
        synchronized (lock) {
            return pending.remove(request.key(), request);
        }
    }

    // ── capacity ────────────────────────────────────────────────────────────

    /** Caller holds {@link #lock}. */
    private void cleanup(Instant now) {
        int before = store.size();
        store.values().removeIf(entry -> !entry.isLive(now));

        if (store.size() >= maxSize) {
            int toEvict = Math.max(1, (int) Math.ceil(store.size() * EVICTION_FRACTION));
            Iterator<String> oldest = store.keySet().iterator();
            for (int i = 0; i < toEvict && oldest.hasNext(); i++) {
                oldest.next();
                oldest.remove();
            }
        }
        log.info("CACHE_CLEANUP before={} after={} maxSize={}", before, store.size(), maxSize);
    }
}
