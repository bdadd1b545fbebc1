package com.marketlevels.common.volatility;

import com.marketlevels.common.model.Candle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HistoricalVolatilityEstimatorTest {

    private final HistoricalVolatilityEstimator estimator = new HistoricalVolatilityEstimator();

    private static List<Candle> closes(double... closes) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            candles.add(new Candle(86_400L * i, closes[i], closes[i], closes[i], closes[i], 0));
        }
        return candles;
    }

    @Test
    @DisplayName("fewer than two returns → no estimate")
    void tooShort() {
        assertTrue(estimator.estimate(new VolatilityInputs(null, closes(100, 101))).isEmpty());
        assertTrue(estimator.estimate(new VolatilityInputs(null, List.of())).isEmpty());
    }

    @Test
    @DisplayName("flat prices → zero volatility, still an estimate")
    void flatPrices() {
        Optional<VolatilityEstimate> estimate = estimator.estimate(new VolatilityInputs(null, closes(50, 50, 50, 50)));
        assertTrue(estimate.isPresent());
        assertEquals(0.0, estimate.get().annualized());
        assertEquals(VolatilitySource.HISTORICAL, estimate.get().source());
    }

    @Test
    @DisplayName("only the most recent 20 returns are used")
    void windowLimit() {
        double[] values = new double[40];
        for (int i = 0; i < values.length; i++) {
            values[i] = 100 + i;
        }
        assertEquals(HistoricalVolatilityEstimator.MAX_RETURNS,
            HistoricalVolatilityEstimator.logReturns(closes(values)).size());
    }

    @Test
    @DisplayName("pairs with a non-positive close are skipped")
    void skipsNonPositive() {
        List<Double> returns = HistoricalVolatilityEstimator.logReturns(closes(100, 0, 100, 110));
        assertEquals(1, returns.size());
        assertEquals(Math.log(1.1), returns.get(0), 1e-12);
    }

    @Test
    @DisplayName("population variance of two returns ±r is r²")
    void populationVariance() {
        double r = Math.log(1.1);
        VolatilityEstimate estimate = estimator.estimate(new VolatilityInputs(null, closes(100, 110, 100))).orElseThrow();
        assertEquals(r * Math.sqrt(252), estimate.annualized(), 1e-9);
    }
}
