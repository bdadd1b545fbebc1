package com.marketlevels.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ExpectedMoveBatchRequest(
    @JsonProperty("symbols")    List<String> symbols,
    @JsonProperty("timeframe")  String       timeframe,
    @JsonProperty("customDays") Integer      customDays
) {}
