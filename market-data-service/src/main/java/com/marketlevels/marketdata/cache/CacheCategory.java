package com.marketlevels.marketdata.cache;

import java.time.Duration;

/**
 * Fixed expiration policy per kind of cached data. Callers pick a category,
 * never a TTL.
 */
public enum CacheCategory {
    PRICE("price", Duration.ofSeconds(30)),
    CHART_DATA("chartData", Duration.ofMinutes(5)),
    LEVELS("levels", Duration.ofMinutes(10)),
    ANALYSIS("analysis", Duration.ofMinutes(2)),
    DEFAULT("default", Duration.ofMinutes(5));

    private final String keyPrefix;
    private final Duration ttl;

    CacheCategory(String keyPrefix, Duration ttl) {
        this.keyPrefix = keyPrefix;
        this.ttl       = ttl;
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    public Duration ttl() {
        return ttl;
    }
}
