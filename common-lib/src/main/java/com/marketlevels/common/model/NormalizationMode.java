package com.marketlevels.common.model;

/**
 * Timestamp handling applied by the candle normalizer.
 * {@link #DAILY} truncates every timestamp to UTC midnight of its date.
 */
public enum NormalizationMode {
    INTRADAY,
    DAILY
}
