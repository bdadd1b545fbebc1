package com.marketlevels.common.volatility;

import com.marketlevels.common.model.Candle;
import com.marketlevels.common.model.ExpectedMoveHorizon;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Annualized historical volatility from the most recent daily log returns:
 * {@code sqrt(populationVariance(returns) * 252)}.
 *
 * <p>Uses at most {@value #MAX_RETURNS} returns; pairs with a non-positive close are
 * skipped. Fewer than {@value #MIN_RETURNS} usable returns yields no estimate.
 */
public final class HistoricalVolatilityEstimator implements VolatilityEstimator {

    static final int MAX_RETURNS = 20;
    static final int MIN_RETURNS = 2;

    @Override
    public Optional<VolatilityEstimate> estimate(VolatilityInputs inputs) {
        List<Double> returns = logReturns(inputs.dailyHistory());
        if (returns.size() < MIN_RETURNS) {
            return Optional.empty();
        }

        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream()
            .mapToDouble(r -> (r - mean) * (r - mean))
            .average()
            .orElse(0.0);
        double annualized = Math.sqrt(variance * ExpectedMoveHorizon.TRADING_DAYS_PER_YEAR);

        if (!Double.isFinite(annualized)) {
            return Optional.empty();
        }
        return Optional.of(new VolatilityEstimate(annualized, VolatilitySource.HISTORICAL));
    }

    static List<Double> logReturns(List<Candle> history) {
        List<Double> returns = new ArrayList<>();
        int n    = history.size();
        int from = Math.max(1, n - MAX_RETURNS);
        for (int i = from; i < n; i++) {
            double prev = history.get(i - 1).close();
            double curr = history.get(i).close();
            if (prev > 0 && curr > 0) {
                returns.add(Math.log(curr / prev));
            }
        }
        return returns;
    }
}
