package com.marketlevels.common.volatility;

import java.util.Optional;

/** Last resort of the chain: always answers with a fixed volatility. */
public final class FixedVolatilityEstimator implements VolatilityEstimator {

    public static final double DEFAULT_VOLATILITY = 0.25;

    private final double volatility;

    public FixedVolatilityEstimator() {
        this(DEFAULT_VOLATILITY);
    }

    public FixedVolatilityEstimator(double volatility) {
        this.volatility = volatility;
    }

    @Override
    public Optional<VolatilityEstimate> estimate(VolatilityInputs inputs) {
        return Optional.of(new VolatilityEstimate(volatility, VolatilitySource.DEFAULT));
    }
}
