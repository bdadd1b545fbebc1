package com.marketlevels.common.volatility;

/** Which estimator supplied the annualized volatility behind a band. */
public enum VolatilitySource {
    IMPLIED,
    HISTORICAL,
    DEFAULT
}
