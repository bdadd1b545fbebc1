package com.marketlevels.common.model;

/**
 * Chart resolutions and the upstream query policy behind each of them.
 *
 * <p>Intraday resolutions map to one intraday query at {@link #providerInterval()}.
 * The provider serves 1m, 5m and 1h bars only, so 15m and 4h are fetched at 5m and 1h.
 * Daily, weekly and monthly resolutions all map to one end-of-day query over
 * {@link #defaultLookbackDays()} days. Whenever {@link #aggregation()} is set, the
 * fetched bars are rolled up locally.
 */
public enum Timeframe {
    ONE_MINUTE     ("1m",      "1m",  true,  "1m",   2,   null),
    FIVE_MINUTES   ("5m",      "5m",  true,  "5m",   2,   null),
    FIFTEEN_MINUTES("15m",     "15m", true,  "5m",   2,   AggregationPeriod.FIFTEEN_MINUTES),
    ONE_HOUR       ("1h",      "1h",  true,  "1h",   14,  null),
    FOUR_HOURS     ("4h",      "4h",  true,  "1h",   14,  AggregationPeriod.FOUR_HOURS),
    DAILY          ("daily",   "1D",  false, null,   30,  null),
    WEEKLY         ("weekly",  "1W",  false, null,   90,  AggregationPeriod.WEEKLY),
    MONTHLY        ("monthly", "1M",  false, null,   365, AggregationPeriod.MONTHLY);

    private final String            value;
    private final String            label;
    private final boolean           intraday;
    private final String            providerInterval;
    private final int               defaultLookbackDays;
    private final AggregationPeriod aggregation;

    Timeframe(String value, String label, boolean intraday, String providerInterval,
              int defaultLookbackDays, AggregationPeriod aggregation) {
        this.value               = value;
        this.label               = label;
        this.intraday            = intraday;
        this.providerInterval    = providerInterval;
        this.defaultLookbackDays = defaultLookbackDays;
        this.aggregation         = aggregation;
    }

    public String value()               { return value; }
    public String label()               { return label; }
    public boolean isIntraday()         { return intraday; }
    public String providerInterval()    { return providerInterval; }
    public int defaultLookbackDays()    { return defaultLookbackDays; }
    public AggregationPeriod aggregation() { return aggregation; }

    public NormalizationMode normalizationMode() {
        return intraday ? NormalizationMode.INTRADAY : NormalizationMode.DAILY;
    }

    /**
     * Looks a timeframe up by its value ({@code "5m"}, {@code "daily"}) or its
     * chart label ({@code "1D"}). Values are matched first and case-sensitively,
     * so {@code "1m"} is one minute while {@code "1M"} is monthly.
     *
     * @return the matching timeframe, or {@code null} when nothing matches
     */
    public static Timeframe fromValue(String raw) {
        if (raw == null) return null;
        String trimmed = raw.trim();
        for (Timeframe tf : values()) {
            if (tf.value.equals(trimmed)) return tf;
        }
        for (Timeframe tf : values()) {
            if (tf.label.equals(trimmed)) return tf;
        }
        for (Timeframe tf : values()) {
            if (!tf.intraday && tf.value.equalsIgnoreCase(trimmed)) return tf;
        }
        return null;
    }
}
