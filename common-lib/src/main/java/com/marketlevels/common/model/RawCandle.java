package com.marketlevels.common.model;

/**
 * Endpoint-neutral shape of one upstream record, before validation.
 *
 * <p>Every upstream adapter maps its own record layout onto this type. Any field may be
 * {@code null}; the timestamp is carried either as {@code epochMillis} or as
 * {@code timeText} (date or datetime), with {@code epochMillis} taking precedence.
 */
public record RawCandle(
    Long   epochMillis,
    String timeText,
    Double open,
    Double high,
    Double low,
    Double close,
    Double volume
) {
    public static RawCandle ofText(String timeText, Double open, Double high,
                                   Double low, Double close, Double volume) {
        return new RawCandle(null, timeText, open, high, low, close, volume);
    }

    public static RawCandle ofEpochMillis(long epochMillis, Double open, Double high,
                                          Double low, Double close, Double volume) {
        return new RawCandle(epochMillis, null, open, high, low, close, volume);
    }
}
