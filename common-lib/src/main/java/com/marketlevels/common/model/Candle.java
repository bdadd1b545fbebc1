package com.marketlevels.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One OHLCV bar. {@code time} is the bar's opening instant in unix seconds.
 * Instances are only created by the normalizer and aggregator, which enforce
 * {@code high >= low} and non-negative prices and volume.
 */
public record Candle(
    @JsonProperty("time")   long   time,
    @JsonProperty("open")   double open,
    @JsonProperty("high")   double high,
    @JsonProperty("low")    double low,
    @JsonProperty("close")  double close,
    @JsonProperty("volume") double volume
) {}
