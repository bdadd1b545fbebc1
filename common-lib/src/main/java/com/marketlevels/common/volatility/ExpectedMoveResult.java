package com.marketlevels.common.volatility;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ExpectedMoveResult(
    @JsonProperty("symbol")           String           symbol,
    @JsonProperty("close")            double           close,
    @JsonProperty("iv")               double           iv,
    @JsonProperty("em")               double           em,
    @JsonProperty("upperEM")          double           upperEM,
    @JsonProperty("lowerEM")          double           lowerEM,
    @JsonProperty("upper2Sigma")      double           upper2Sigma,
    @JsonProperty("lower2Sigma")      double           lower2Sigma,
    @JsonProperty("timeframe")        String           timeframe,
    @JsonProperty("tradingDays")      int              tradingDays,
    @JsonProperty("volatilitySource") VolatilitySource volatilitySource
) implements ExpectedMoveOutcome {

    @JsonIgnore
    @Override
    public boolean isDisplayable() {
        return true;
    }
}
