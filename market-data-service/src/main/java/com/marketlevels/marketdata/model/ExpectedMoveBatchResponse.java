package com.marketlevels.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketlevels.common.volatility.ExpectedMoveResult;
import com.marketlevels.common.volatility.ExpectedMoveTooSmall;

import java.util.List;
import java.util.Map;

/**
 * Batch outcome. A symbol appears in exactly one of {@code results},
 * {@code tooSmall} or {@code errors}; {@code errors} maps the user's input to a
 * user-safe message.
 */
public record ExpectedMoveBatchResponse(
    @JsonProperty("results")  List<ExpectedMoveResult>   results,
    @JsonProperty("tooSmall") List<ExpectedMoveTooSmall> tooSmall,
    @JsonProperty("errors")   Map<String, String>        errors
) {}
