package com.marketlevels.common.volatility;

import java.util.Optional;

/** Uses the provider-supplied implied volatility when it is finite and positive. */
public final class ImpliedVolatilityEstimator implements VolatilityEstimator {

    @Override
    public Optional<VolatilityEstimate> estimate(VolatilityInputs inputs) {
        Double iv = inputs.impliedVolatility();
        if (iv == null || !Double.isFinite(iv) || iv <= 0) {
            return Optional.empty();
        }
        return Optional.of(new VolatilityEstimate(iv, VolatilitySource.IMPLIED));
    }
}
