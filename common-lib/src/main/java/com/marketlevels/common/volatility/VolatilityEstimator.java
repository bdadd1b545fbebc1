package com.marketlevels.common.volatility;

import java.util.Optional;

/**
 * One step of the volatility fallback chain. Returns empty when it cannot
 * produce a usable estimate, letting the next estimator try.
 */
public interface VolatilityEstimator {
    Optional<VolatilityEstimate> estimate(VolatilityInputs inputs);
}
