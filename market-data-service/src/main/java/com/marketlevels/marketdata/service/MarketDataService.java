package com.marketlevels.marketdata.service;

import com.marketlevels.common.candle.CandleNormalizer;
import com.marketlevels.common.candle.TimeframeAggregator;
import com.marketlevels.common.exception.MarketDataException;
import com.marketlevels.common.model.Candle;
import com.marketlevels.common.model.CandleSeries;
import com.marketlevels.common.model.RawCandle;
import com.marketlevels.common.model.Timeframe;
import com.marketlevels.common.symbol.ResolutionError;
import com.marketlevels.common.symbol.ResolvedSymbol;
import com.marketlevels.common.symbol.SymbolResolution;
import com.marketlevels.common.symbol.SymbolResolver;
import com.marketlevels.marketdata.cache.CacheCategory;
import com.marketlevels.marketdata.cache.CacheKeys;
import com.marketlevels.marketdata.cache.MarketDataCache;
import com.marketlevels.marketdata.client.MarketDataWebClient;
import com.marketlevels.marketdata.model.ChartData;
import com.marketlevels.marketdata.model.DateRange;
import com.marketlevels.marketdata.model.Quote;
import com.marketlevels.marketdata.provider.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Candle and quote access behind the shared {@link MarketDataCache}.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Resolve the user symbol; resolution errors fail before any cache or upstream work.</li>
 *   <li>Bound the date range from the timeframe's default lookback.</li>
 *   <li>{@code getOrFetch} on {@code chartData:<symbol>:<timeframe>:<range>}: concurrent
 *       identical requests share one upstream call.</li>
 *   <li>On miss: one intraday or end-of-day query, normalization, and a local roll-up
 *       for 15m/4h (from 5m/1h bars) and weekly/monthly (from daily bars). An empty result is {@code NO_DATA}.</li>
 * </ol>
 */
@Service
public class MarketDataService implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final MarketDataWebClient client;
    private final MarketDataCache     cache;
    private final Clock               clock;

    public MarketDataService(MarketDataWebClient client, MarketDataCache cache, Clock clock) {
        this.client = client;
        this.cache  = cache;
        this.clock  = clock;
    }

    public SymbolResolution resolve(String input) {
        return SymbolResolver.resolve(input);
    }

    @Override
    public Mono<ChartData> fetchCandles(String userSymbol, Timeframe timeframe, DateRange range) {
        return Mono.defer(() -> {
            ResolvedSymbol symbol = requireResolved(userSymbol);
            DateRange window = (range == null ? DateRange.unbounded() : range)
                .resolve(LocalDate.now(clock), timeframe.defaultLookbackDays());
            String key = CacheKeys.of(CacheCategory.CHART_DATA, symbol.providerSymbol(), timeframe.value(), window);

            return cache.<CandleSeries>getOrFetch(key, CacheCategory.CHART_DATA,
                    () -> loadSeries(symbol.providerSymbol(), timeframe, window))
                .map(series -> ChartData.of(series, symbol.assetClass()));
        });
    }

    @Override
    public Mono<Quote> getQuote(String userSymbol) {
        return Mono.defer(() -> {
            ResolvedSymbol symbol = requireResolved(userSymbol);
            String key = CacheKeys.of(CacheCategory.PRICE, symbol.providerSymbol());
            return cache.<Quote>getOrFetch(key, CacheCategory.PRICE,
                () -> client.fetchQuote(symbol.providerSymbol()));
        });
    }

    /** @throws MarketDataException {@code INVALID_INPUT} or {@code UNSUPPORTED} */
    public ResolvedSymbol requireResolved(String userSymbol) {
        SymbolResolution resolution = SymbolResolver.resolve(userSymbol);
        if (resolution instanceof ResolvedSymbol resolved) {
            return resolved;
        }
        throw ((ResolutionError) resolution).toException();
    }

    // ── upstream ────────────────────────────────────────────────────────────

    private Mono<CandleSeries> loadSeries(String providerSymbol, Timeframe timeframe, DateRange window) {
        return fetchRaw(providerSymbol, timeframe, window)
            .map(raw -> toSeries(providerSymbol, timeframe, raw));
    }

    private Mono<List<RawCandle>> fetchRaw(String providerSymbol, Timeframe timeframe, DateRange window) {
        if (!timeframe.isIntraday()) {
            return client.fetchEndOfDay(providerSymbol, window.from(), window.to());
        }
        Instant now  = clock.instant();
        Instant from = window.from().atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant end  = window.to().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to   = end.isAfter(now) ? now : end;
        return client.fetchIntraday(providerSymbol, timeframe.providerInterval(), from, to);
    }

    private CandleSeries toSeries(String providerSymbol, Timeframe timeframe, List<RawCandle> raw) {
        List<Candle> candles = CandleNormalizer.normalize(raw, timeframe.normalizationMode());
        int dropped = CandleNormalizer.countDropped(raw, candles);
        if (dropped > 0) {
            log.debug("CANDLES_DROPPED symbol={} timeframe={} dropped={} kept={}",
                      providerSymbol, timeframe.value(), dropped, candles.size());
        }
        if (timeframe.aggregation() != null) {
            candles = TimeframeAggregator.aggregate(candles, timeframe.aggregation());
        }
        if (candles.isEmpty()) {
            throw MarketDataException.noData(providerSymbol);
        }
        log.info("Candles ready. symbol={} timeframe={} candles={}", providerSymbol, timeframe.value(), candles.size());
        return new CandleSeries(providerSymbol, timeframe, candles);
    }
}
