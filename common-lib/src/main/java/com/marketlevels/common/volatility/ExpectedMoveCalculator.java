package com.marketlevels.common.volatility;

import com.marketlevels.common.exception.MarketDataErrorKind;
import com.marketlevels.common.exception.MarketDataException;
import com.marketlevels.common.model.Candle;
import com.marketlevels.common.model.ExpectedMoveHorizon;

import java.util.List;
import java.util.Optional;

/**
 * Volatility-scaled price band around a close.
 *
 * <p>{@code EM = close * IV * sqrt(tradingDays / 252)}; the band edges are
 * {@code close ± EM} and {@code close ± 2·EM}. When {@code EM} is below
 * {@value #NOISE_FLOOR} of the close the outcome is {@link ExpectedMoveTooSmall}.
 *
 * <p>IV comes from the first estimator of the chain that answers:
 * provider IV → historical volatility → fixed 0.25.
 */
public final class ExpectedMoveCalculator {

    public static final double NOISE_FLOOR = 0.005;

    private final List<VolatilityEstimator> estimators;

    public ExpectedMoveCalculator() {
        this(List.of(
            new ImpliedVolatilityEstimator(),
            new HistoricalVolatilityEstimator(),
            new FixedVolatilityEstimator()
        ));
    }

    public ExpectedMoveCalculator(List<VolatilityEstimator> estimators) {
        if (estimators == null || estimators.isEmpty()) {
            throw new IllegalArgumentException("At least one volatility estimator is required");
        }
        this.estimators = List.copyOf(estimators);
    }

    /**
     * @param symbol            provider symbol, echoed in the result
     * @param close             latest close; must be finite and positive
     * @param horizon           band horizon
     * @param customDays        trading days for {@link ExpectedMoveHorizon#CUSTOM}, else ignored
     * @param impliedVolatility provider IV or {@code null}
     * @param dailyHistory      time-ascending daily candles for the historical estimate
     */
    public ExpectedMoveOutcome compute(String symbol, double close, ExpectedMoveHorizon horizon,
                                       Integer customDays, Double impliedVolatility,
                                       List<Candle> dailyHistory) {
        if (!Double.isFinite(close) || close <= 0) {
            throw new MarketDataException(MarketDataErrorKind.INVALID_RESPONSE,
                "Invalid close price for symbol " + symbol + ": " + close);
        }

        int tradingDays = horizon.tradingDays(customDays);
        VolatilityEstimate vol = estimateVolatility(new VolatilityInputs(impliedVolatility, dailyHistory));

        double t  = (double) tradingDays / ExpectedMoveHorizon.TRADING_DAYS_PER_YEAR;
        double em = close * vol.annualized() * Math.sqrt(t);

        if (em < close * NOISE_FLOOR) {
            return new ExpectedMoveTooSmall(symbol, close, vol.annualized(), em,
                horizon.value(), tradingDays, vol.source(), ExpectedMoveTooSmall.MESSAGE);
        }

        return new ExpectedMoveResult(
            symbol,
            close,
            vol.annualized(),
            em,
            close + em,
            close - em,
            close + 2 * em,
            close - 2 * em,
            horizon.value(),
            tradingDays,
            vol.source()
        );
    }

    VolatilityEstimate estimateVolatility(VolatilityInputs inputs) {
        for (VolatilityEstimator estimator : estimators) {
            Optional<VolatilityEstimate> estimate = estimator.estimate(inputs);
            if (estimate.isPresent()) {
                return estimate.get();
            }
        }
        // only reachable with a chain that has no unconditional last step
        return new VolatilityEstimate(FixedVolatilityEstimator.DEFAULT_VOLATILITY, VolatilitySource.DEFAULT);
    }
}
