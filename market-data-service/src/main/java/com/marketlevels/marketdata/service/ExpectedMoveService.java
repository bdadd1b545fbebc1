package com.marketlevels.marketdata.service;

import com.marketlevels.common.exception.MarketDataErrorKind;
import com.marketlevels.common.exception.MarketDataException;
import com.marketlevels.common.model.Candle;
import com.marketlevels.common.model.ExpectedMoveHorizon;
import com.marketlevels.common.model.Timeframe;
import com.marketlevels.common.symbol.ResolvedSymbol;
import com.marketlevels.common.volatility.ExpectedMoveCalculator;
import com.marketlevels.common.volatility.ExpectedMoveOutcome;
import com.marketlevels.common.volatility.ExpectedMoveResult;
import com.marketlevels.common.volatility.ExpectedMoveTooSmall;
import com.marketlevels.marketdata.cache.CacheCategory;
import com.marketlevels.marketdata.cache.CacheKeys;
import com.marketlevels.marketdata.cache.MarketDataCache;
import com.marketlevels.marketdata.client.ImpliedVolatilityClient;
import com.marketlevels.marketdata.model.ChartData;
import com.marketlevels.marketdata.model.ExpectedMoveBatchResponse;
import com.marketlevels.marketdata.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expected-move bands for one symbol, a batch of symbols, or a chart overlay.
 *
 * <p>Inputs are gathered reactively: daily history from {@link MarketDataService},
 * the close from the latest quote (the last daily close when the quote fails),
 * and options IV when the provider has it. The band itself is computed by
 * {@link ExpectedMoveCalculator}.
 */
@Service
public class ExpectedMoveService {

    private static final Logger log = LoggerFactory.getLogger(ExpectedMoveService.class);

    private final MarketDataService       marketData;
    private final ImpliedVolatilityClient ivClient;
    private final ExpectedMoveCalculator  calculator;
    private final MarketDataCache         cache;
    private final int                     batchWidth;

    public ExpectedMoveService(MarketDataService marketData,
                               ImpliedVolatilityClient ivClient,
                               ExpectedMoveCalculator calculator,
                               MarketDataCache cache,
                               @Value("${market-data.expected-move.batch-width:5}") int batchWidth) {
        this.marketData = marketData;
        this.ivClient   = ivClient;
        this.calculator = calculator;
        this.cache      = cache;
        this.batchWidth = Math.max(1, batchWidth);
    }

    public Mono<ExpectedMoveOutcome> computeExpectedMove(String userSymbol, ExpectedMoveHorizon horizon,
                                                         Integer customDays) {
        return Mono.defer(() -> {
            ResolvedSymbol symbol = marketData.requireResolved(userSymbol);
            String key = CacheKeys.of(CacheCategory.ANALYSIS, symbol.providerSymbol(), horizon.value(),
                horizon == ExpectedMoveHorizon.CUSTOM ? horizon.tradingDays(customDays) : null);
            return cache.<ExpectedMoveOutcome>getOrFetch(key, CacheCategory.ANALYSIS,
                () -> compute(symbol, horizon, customDays));
        });
    }

    /**
     * Runs {@link #computeExpectedMove} for every distinct symbol, at most {@code batch-width} at a time.
     * A failing symbol lands in {@code errors} with a user-safe message; the batch itself never fails.
     */
    public Mono<ExpectedMoveBatchResponse> computeBatch(List<String> symbols, ExpectedMoveHorizon horizon,
                                                        Integer customDays) {
        log.info("Expected-move batch. symbols={} horizon={} width={}", symbols.size(), horizon.value(), batchWidth);
        return Flux.fromIterable(symbols)
            .distinct()
            .flatMapSequential(symbol -> computeExpectedMove(symbol, horizon, customDays)
                .map(outcome -> new BatchItem(symbol, outcome, null))
                .onErrorResume(e -> {
                    log.warn("Expected-move batch item failed. symbol={} reason={}", symbol, e.getMessage());
                    return Mono.just(new BatchItem(symbol, null, publicMessage(e)));
                }), batchWidth)
            .collectList()
            .map(ExpectedMoveService::assemble);
    }

    /** The band drawn over a chart: the horizon follows the chart's timeframe. */
    public Mono<ExpectedMoveOutcome> levelsFor(String userSymbol, Timeframe chartTimeframe) {
        return Mono.defer(() -> {
            ResolvedSymbol symbol = marketData.requireResolved(userSymbol);
            ExpectedMoveHorizon horizon = ExpectedMoveHorizon.forChart(chartTimeframe);
            String key = CacheKeys.of(CacheCategory.LEVELS, symbol.providerSymbol(), chartTimeframe.value());
            return cache.<ExpectedMoveOutcome>getOrFetch(key, CacheCategory.LEVELS,
                () -> computeExpectedMove(symbol.providerSymbol(), horizon, null));
        });
    }

    static String publicMessage(Throwable e) {
        if (e instanceof MarketDataException mde) {
            return mde.getKind().publicMessage();
        }
        return MarketDataErrorKind.UPSTREAM_UNAVAILABLE.publicMessage();
    }

    // ── private ─────────────────────────────────────────────────────────────

    private Mono<ExpectedMoveOutcome> compute(ResolvedSymbol symbol, ExpectedMoveHorizon horizon, Integer customDays) {
        String providerSymbol = symbol.providerSymbol();
        return dailyHistory(providerSymbol)
            .flatMap(history -> latestClose(providerSymbol, history)
                .flatMap(close -> ivClient.fetchAtTheMoneyIv(providerSymbol, symbol.assetClass(), close)
                    .map(iv -> calculator.compute(providerSymbol, close, horizon, customDays,
                                                  iv.orElse(null), history))))
            .doOnNext(outcome -> log.info("EXPECTED_MOVE symbol={} horizon={} displayable={} source={}",
                providerSymbol, horizon.value(), outcome.isDisplayable(), sourceOf(outcome)));
    }

    /** History is optional input; without it the chain skips historical volatility. */
    private Mono<List<Candle>> dailyHistory(String providerSymbol) {
        return marketData.fetchCandles(providerSymbol, Timeframe.DAILY, null)
            .map(ChartData::candles)
            .onErrorResume(e -> {
                log.warn("Daily history unavailable for symbol={}. reason={}", providerSymbol, e.getMessage());
                return Mono.just(List.of());
            });
    }

    private Mono<Double> latestClose(String providerSymbol, List<Candle> history) {
        return marketData.getQuote(providerSymbol)
            .map(Quote::price)
            .onErrorResume(e -> {
                if (history.isEmpty()) {
                    return Mono.error(e);
                }
                double close = history.get(history.size() - 1).close();
                log.warn("Quote unavailable for symbol={}, using last daily close={}. reason={}",
                         providerSymbol, close, e.getMessage());
                return Mono.just(close);
            });
    }

    private static Object sourceOf(ExpectedMoveOutcome outcome) {
        if (outcome instanceof ExpectedMoveResult r) return r.volatilitySource();
        if (outcome instanceof ExpectedMoveTooSmall t) return t.volatilitySource();
        return null;
    }

    private static ExpectedMoveBatchResponse assemble(List<BatchItem> items) {
        List<ExpectedMoveResult>   results  = new ArrayList<>();
        List<ExpectedMoveTooSmall> tooSmall = new ArrayList<>();
        Map<String, String>        errors   = new LinkedHashMap<>();
        for (BatchItem item : items) {
            if (item.error() != null) {
                errors.put(item.symbol(), item.error());
            } else if (item.outcome() instanceof ExpectedMoveResult r) {
                results.add(r);
            } else if (item.outcome() instanceof ExpectedMoveTooSmall t) {
                tooSmall.add(t);
            }
        }
        return new ExpectedMoveBatchResponse(results, tooSmall, errors);
    }

    private record BatchItem(String symbol, ExpectedMoveOutcome outcome, String error) {}
}
