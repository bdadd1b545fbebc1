package com.marketlevels.common.model;

import java.util.List;

/**
 * Time-ascending candles for one (provider symbol, timeframe) pair.
 * The candle list is copied on construction and never mutated afterwards.
 */
public record CandleSeries(
    String       providerSymbol,
    Timeframe    timeframe,
    List<Candle> candles
) {
    public CandleSeries {
        candles = candles == null ? List.of() : List.copyOf(candles);
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    /** Close of the most recent candle, or {@code null} for an empty series. */
    public Double lastPrice() {
        return candles.isEmpty() ? null : candles.get(candles.size() - 1).close();
    }
}
