package com.marketlevels.marketdata.cache;

import java.util.StringJoiner;

/**
 * Deterministic cache keys: {@code category:part1:part2:…}. {@code null} parts
 * are rendered as {@code -} so optional components never collide with present ones.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String of(CacheCategory category, Object... parts) {
        StringJoiner joiner = new StringJoiner(":");
        joiner.add(category.keyPrefix());
        for (Object part : parts) {
            joiner.add(part == null ? "-" : part.toString());
        }
        return joiner.toString();
    }
}
