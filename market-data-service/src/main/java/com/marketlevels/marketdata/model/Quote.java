package com.marketlevels.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Latest quote for a provider symbol. Only {@code price} is guaranteed;
 * the other fields are {@code null} when the provider omits them.
 */
public record Quote(
    @JsonProperty("symbol")        String  symbol,
    @JsonProperty("price")         double  price,
    @JsonProperty("open")          Double  open,
    @JsonProperty("high")          Double  high,
    @JsonProperty("low")           Double  low,
    @JsonProperty("previousClose") Double  previousClose,
    @JsonProperty("change")        Double  change,
    @JsonProperty("changePercent") Double  changePercent,
    @JsonProperty("volume")        Double  volume,
    @JsonProperty("timestamp")     Instant timestamp
) {}
