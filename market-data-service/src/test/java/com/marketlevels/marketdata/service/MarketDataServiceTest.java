package com.marketlevels.marketdata.service;

import com.marketlevels.common.exception.MarketDataErrorKind;
import com.marketlevels.common.exception.MarketDataException;
import com.marketlevels.common.model.AssetClass;
import com.marketlevels.common.model.RawCandle;
import com.marketlevels.common.model.Timeframe;
import com.marketlevels.marketdata.cache.MarketDataCache;
import com.marketlevels.marketdata.client.MarketDataWebClient;
import com.marketlevels.marketdata.model.ChartData;
import com.marketlevels.marketdata.model.DateRange;
import com.marketlevels.marketdata.model.Quote;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarketDataServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-10T15:00:00Z");

    @Mock
    private MarketDataWebClient client;

    private MarketDataService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new MarketDataService(client, new MarketDataCache(clock, 100), clock);
    }

    private static RawCandle day(String date, double close) {
        return RawCandle.ofText(date, close, close + 1, close - 1, close, 100.0);
    }

    private static void assertKind(MarketDataErrorKind kind, Throwable e) {
        assertEquals(kind, assertInstanceOf(MarketDataException.class, e).getKind());
    }

    @Test
    @DisplayName("daily candles: resolved symbol, default lookback, normalized output")
    void dailyCandles() {
        when(client.fetchEndOfDay("AAPL.US", LocalDate.parse("2023-12-11"), LocalDate.parse("2024-01-10")))
            .thenReturn(Mono.just(List.of(
                day("2024-01-09", 11),
                day("2024-01-08", 10),
                RawCandle.ofText("2024-01-10", 1.0, 2.0, 0.5, null, 1.0))));

        ChartData chart = service.fetchCandles("aapl", Timeframe.DAILY, null).block();

        assertEquals("AAPL.US", chart.symbol());
        assertEquals(AssetClass.EQUITY, chart.assetClass());
        assertEquals("daily", chart.timeframe());
        assertEquals(2, chart.candles().size());
        assertEquals(10.0, chart.candles().get(0).close());
        assertEquals(11.0, chart.lastPrice());
    }

    @Test
    @DisplayName("weekly candles are rolled up from the end-of-day series")
    void weeklyCandles() {
        when(client.fetchEndOfDay(eq("AAPL.US"), any(), any())).thenReturn(Mono.just(List.of(
            day("2024-01-02", 10), day("2024-01-03", 12), day("2024-01-08", 13), day("2024-01-09", 9))));

        ChartData chart = service.fetchCandles("AAPL.US", Timeframe.WEEKLY, null).block();

        assertEquals(2, chart.candles().size());
        assertEquals(12.0, chart.candles().get(0).close());
        assertEquals(9.0, chart.lastPrice());
        verify(client).fetchEndOfDay("AAPL.US", LocalDate.parse("2023-10-12"), LocalDate.parse("2024-01-10"));
    }

    @Test
    @DisplayName("intraday window starts at UTC midnight and ends now")
    void intradayWindow() {
        long ts = Instant.parse("2024-01-10T14:55:00Z").toEpochMilli();
        when(client.fetchIntraday(anyString(), anyString(), any(), any())).thenReturn(Mono.just(List.of(
            RawCandle.ofEpochMillis(ts, 1.0, 2.0, 0.5, 1.5, 10.0))));

        ChartData chart = service.fetchCandles("bitcoin", Timeframe.FIVE_MINUTES, null).block();

        assertEquals(ts / 1000, chart.candles().get(0).time());
        verify(client).fetchIntraday("BTC-USD.CC", "5m", Instant.parse("2024-01-08T00:00:00Z"), NOW);
    }

    @Test
    @DisplayName("15m candles are fetched at 5m and rolled up locally")
    void fifteenMinuteRollUp() {
        long base = Instant.parse("2024-01-10T14:00:00Z").toEpochMilli();
        List<RawCandle> fiveMinute = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            double px = 100 + i;
            fiveMinute.add(RawCandle.ofEpochMillis(base + i * 300_000L, px, px + 1, px - 1, px, 10.0));
        }
        when(client.fetchIntraday(anyString(), anyString(), any(), any())).thenReturn(Mono.just(fiveMinute));

        ChartData chart = service.fetchCandles("AAPL", Timeframe.FIFTEEN_MINUTES, null).block();

        verify(client).fetchIntraday(eq("AAPL.US"), eq("5m"), any(), any());
        assertEquals(2, chart.candles().size());
        assertEquals(base / 1000, chart.candles().get(0).time());
        assertEquals(102, chart.candles().get(0).close());
        assertEquals(30, chart.candles().get(0).volume());
        assertEquals(105.0, chart.lastPrice());
    }

    @Test
    @DisplayName("4h candles are fetched at 1h")
    void fourHourInterval() {
        long ts = Instant.parse("2024-01-10T09:00:00Z").toEpochMilli();
        when(client.fetchIntraday(anyString(), anyString(), any(), any())).thenReturn(Mono.just(List.of(
            RawCandle.ofEpochMillis(ts, 1.0, 2.0, 0.5, 1.5, 10.0))));

        ChartData chart = service.fetchCandles("AAPL", Timeframe.FOUR_HOURS, null).block();

        verify(client).fetchIntraday(eq("AAPL.US"), eq("1h"), any(), any());
        assertEquals(Instant.parse("2024-01-10T09:00:00Z").getEpochSecond(), chart.candles().get(0).time());
    }

    @Test
    @DisplayName("repeat request within TTL is served from cache")
    void cachedWithinTtl() {
        when(client.fetchEndOfDay(eq("AAPL.US"), any(), any())).thenReturn(Mono.just(List.of(day("2024-01-09", 11))));

        service.fetchCandles("AAPL", Timeframe.DAILY, null).block();
        service.fetchCandles("aapl.us", Timeframe.DAILY, null).block();

        verify(client, times(1)).fetchEndOfDay(anyString(), any(), any());
    }

    @Test
    @DisplayName("identical concurrent requests share one upstream call")
    void coalesced() {
        Sinks.One<List<RawCandle>> upstream = Sinks.one();
        when(client.fetchEndOfDay(eq("AAPL.US"), any(), any())).thenReturn(upstream.asMono());

        List<ChartData> results = new ArrayList<>();
        service.fetchCandles("AAPL", Timeframe.DAILY, null).subscribe(results::add);
        service.fetchCandles("AAPL", Timeframe.DAILY, null).subscribe(results::add);
        upstream.tryEmitValue(List.of(day("2024-01-09", 11)));

        assertEquals(2, results.size());
        verify(client, times(1)).fetchEndOfDay(anyString(), any(), any());
    }

    @Test
    @DisplayName("no valid candles → NO_DATA, and nothing is cached")
    void noData() {
        when(client.fetchEndOfDay(eq("AAPL.US"), any(), any())).thenReturn(Mono.just(List.of()));

        StepVerifier.create(service.fetchCandles("AAPL", Timeframe.DAILY, null))
            .expectErrorSatisfies(e -> assertKind(MarketDataErrorKind.NO_DATA, e))
            .verify();
        StepVerifier.create(service.fetchCandles("AAPL", Timeframe.DAILY, null))
            .expectError(MarketDataException.class)
            .verify();
        verify(client, times(2)).fetchEndOfDay(anyString(), any(), any());
    }

    @Test
    @DisplayName("unresolvable symbol fails before any upstream call")
    void unsupportedSymbol() {
        StepVerifier.create(service.fetchCandles("??", Timeframe.DAILY, null))
            .expectErrorSatisfies(e -> assertKind(MarketDataErrorKind.UNSUPPORTED, e))
            .verify();
        StepVerifier.create(service.getQuote(" "))
            .expectErrorSatisfies(e -> assertKind(MarketDataErrorKind.INVALID_INPUT, e))
            .verify();
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("range with from after to → INVALID_INPUT")
    void invertedRange() {
        DateRange inverted = new DateRange(LocalDate.parse("2024-01-09"), LocalDate.parse("2024-01-01"));
        StepVerifier.create(service.fetchCandles("AAPL", Timeframe.DAILY, inverted))
            .expectErrorSatisfies(e -> assertKind(MarketDataErrorKind.INVALID_INPUT, e))
            .verify();
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("quotes are cached per provider symbol")
    void quoteCached() {
        Quote quote = new Quote("ETH-USD.CC", 2300.0, null, null, null, null, null, null, null, NOW);
        when(client.fetchQuote("ETH-USD.CC")).thenReturn(Mono.just(quote));

        assertEquals(quote, service.getQuote("ethereum").block());
        assertEquals(quote, service.getQuote("ETH").block());
        verify(client, times(1)).fetchQuote("ETH-USD.CC");
    }

    @Test
    @DisplayName("upstream failure propagates with its kind")
    void upstreamFailure() {
        when(client.fetchQuote("AAPL.US")).thenReturn(Mono.error(
            new MarketDataException(MarketDataErrorKind.UPSTREAM_UNAVAILABLE, "down")));

        StepVerifier.create(service.getQuote("AAPL"))
            .expectErrorSatisfies(e -> assertKind(MarketDataErrorKind.UPSTREAM_UNAVAILABLE, e))
            .verify();
    }
}
