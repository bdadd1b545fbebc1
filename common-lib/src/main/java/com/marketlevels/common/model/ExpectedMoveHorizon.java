package com.marketlevels.common.model;

import java.util.Locale;

/**
 * Horizon of an expected-move band, expressed in trading days out of a 252-day year.
 */
public enum ExpectedMoveHorizon {
    DAILY("daily", 1),
    WEEKLY("weekly", 5),
    MONTHLY("monthly", 21),
    CUSTOM("custom", 5);

    public static final int TRADING_DAYS_PER_YEAR = 252;

    private final String value;
    private final int    defaultDays;

    ExpectedMoveHorizon(String value, int defaultDays) {
        this.value       = value;
        this.defaultDays = defaultDays;
    }

    public String value() {
        return value;
    }

    /**
     * Trading days covered by this horizon. {@code customDays} only applies to
     * {@link #CUSTOM}; a missing or non-positive value falls back to 5.
     */
    public int tradingDays(Integer customDays) {
        if (this == CUSTOM && customDays != null && customDays > 0) {
            return customDays;
        }
        return defaultDays;
    }

    /** @return the matching horizon, or {@code null} when {@code raw} names none */
    public static ExpectedMoveHorizon fromValue(String raw) {
        if (raw == null) return null;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (ExpectedMoveHorizon horizon : values()) {
            if (horizon.value.equals(key)) return horizon;
        }
        return null;
    }

    /** Horizon used for the level overlay of a chart drawn at {@code timeframe}. */
    public static ExpectedMoveHorizon forChart(Timeframe timeframe) {
        return switch (timeframe) {
            case WEEKLY  -> WEEKLY;
            case MONTHLY -> MONTHLY;
            default      -> DAILY;
        };
    }
}
