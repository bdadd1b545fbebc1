package com.marketlevels.common.volatility;

import com.marketlevels.common.model.Candle;

import java.util.List;

/**
 * Everything an estimator may draw on.
 *
 * @param impliedVolatility provider-supplied IV, {@code null} when unavailable
 * @param dailyHistory      time-ascending daily candles, possibly empty
 */
public record VolatilityInputs(Double impliedVolatility, List<Candle> dailyHistory) {
    public VolatilityInputs {
        dailyHistory = dailyHistory == null ? List.of() : dailyHistory;
    }
}
