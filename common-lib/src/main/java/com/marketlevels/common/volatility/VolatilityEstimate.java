package com.marketlevels.common.volatility;

/** Annualized volatility together with the estimator that produced it. */
public record VolatilityEstimate(double annualized, VolatilitySource source) {}
