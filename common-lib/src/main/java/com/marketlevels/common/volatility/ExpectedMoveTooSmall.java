package com.marketlevels.common.volatility;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The computed move fell under the noise floor; callers show no band.
 */
public record ExpectedMoveTooSmall(
    @JsonProperty("symbol")           String           symbol,
    @JsonProperty("close")            double           close,
    @JsonProperty("iv")               double           iv,
    @JsonProperty("em")               double           em,
    @JsonProperty("timeframe")        String           timeframe,
    @JsonProperty("tradingDays")      int              tradingDays,
    @JsonProperty("volatilitySource") VolatilitySource volatilitySource,
    @JsonProperty("message")          String           message
) implements ExpectedMoveOutcome {

    public static final String MESSAGE = "Expected move too small to display (< 0.5% of price)";

    @JsonProperty("tooSmall")
    public boolean tooSmall() {
        return true;
    }

    @JsonIgnore
    @Override
    public boolean isDisplayable() {
        return false;
    }
}
