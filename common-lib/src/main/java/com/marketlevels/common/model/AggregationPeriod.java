package com.marketlevels.common.model;

/** Period a finer series can be rolled up into. Fixed-width periods are aligned to the UTC epoch. */
public enum AggregationPeriod {
    FIFTEEN_MINUTES(15 * 60),
    FOUR_HOURS(4 * 60 * 60),
    WEEKLY(0),
    MONTHLY(0);

    private final long widthSeconds;

    AggregationPeriod(long widthSeconds) {
        this.widthSeconds = widthSeconds;
    }

    /** Bucket width in seconds; {@code 0} for calendar periods. */
    public long widthSeconds() { return widthSeconds; }
}
