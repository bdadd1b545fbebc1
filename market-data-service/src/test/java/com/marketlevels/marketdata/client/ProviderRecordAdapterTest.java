package com.marketlevels.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketlevels.common.exception.MarketDataErrorKind;
import com.marketlevels.common.exception.MarketDataException;
import com.marketlevels.common.model.RawCandle;
import com.marketlevels.marketdata.model.Quote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProviderRecordAdapterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    @DisplayName("short field names are accepted alongside long ones")
    void shortFieldNames() throws Exception {
        List<RawCandle> records = ProviderRecordAdapter.fromEndOfDay(json(
            "[{\"date\":\"2024-01-02\",\"o\":1,\"h\":2,\"l\":0.5,\"c\":1.5,\"v\":7}]"));

        RawCandle raw = records.get(0);
        assertEquals(1.0, raw.open());
        assertEquals(2.0, raw.high());
        assertEquals(0.5, raw.low());
        assertEquals(1.5, raw.close());
        assertEquals(7.0, raw.volume());
        assertNull(raw.epochMillis());
    }

    @Test
    @DisplayName("end-of-day record without a date falls back to a numeric timestamp")
    void endOfDayTimestampFallback() throws Exception {
        RawCandle raw = ProviderRecordAdapter.fromEndOfDay(json(
            "[{\"t\":1704153600000,\"open\":1,\"high\":2,\"low\":0.5,\"close\":1.5}]")).get(0);
        assertEquals(1704153600000L, raw.epochMillis());
        assertNull(raw.volume());
    }

    @Test
    @DisplayName("intraday record without a timestamp falls back to its datetime text")
    void intradayTextFallback() throws Exception {
        RawCandle raw = ProviderRecordAdapter.fromIntraday(json(
            "[{\"datetime\":\"2024-01-02 14:30:00\",\"open\":1,\"high\":2,\"low\":0.5,\"close\":1.5}]")).get(0);
        assertNull(raw.epochMillis());
        assertEquals("2024-01-02 14:30:00", raw.timeText());
    }

    @Test
    @DisplayName("\"NA\" and other unparseable numbers become null")
    void unparseableNumbers() throws Exception {
        JsonNode node = json("{\"a\":\"NA\",\"b\":\" 12.5 \",\"c\":null}");
        assertNull(ProviderRecordAdapter.number(node, "a"));
        assertEquals(12.5, ProviderRecordAdapter.number(node, "b"));
        assertNull(ProviderRecordAdapter.number(node, "c", "missing"));
    }

    @Test
    @DisplayName("an unparseable long name falls through to the short alias")
    void unparseableAliasFallsThrough() throws Exception {
        JsonNode node = json("{\"open\":\"NA\",\"o\":1.5,\"high\":\"Infinity\",\"h\":2}");
        assertEquals(1.5, ProviderRecordAdapter.number(node, "open", "o"));
        assertEquals(2.0, ProviderRecordAdapter.number(node, "high", "h"));
    }

    @Test
    @DisplayName("end-of-day record with NA long names still reads the short ones")
    void endOfDayAliasFallback() throws Exception {
        RawCandle raw = ProviderRecordAdapter.fromEndOfDay(json(
            "[{\"date\":\"2024-01-02\",\"open\":\"NA\",\"o\":1,\"close\":\"NA\",\"c\":1.5}]")).get(0);
        assertEquals(1.0, raw.open());
        assertEquals(1.5, raw.close());
    }

    @Test
    @DisplayName("quote price skips a zero close and uses previousClose")
    void quoteZeroCloseFallback() throws Exception {
        Quote quote = ProviderRecordAdapter.toQuote("AAPL.US",
            json("{\"close\":0,\"previousClose\":150}"));
        assertEquals(150.0, quote.price());
    }

    @Test
    @DisplayName("quote price prefers last over previousClose when close is NA")
    void quoteLastBeforePreviousClose() throws Exception {
        Quote quote = ProviderRecordAdapter.toQuote("AAPL.US",
            json("{\"close\":\"NA\",\"last\":151.2,\"previousClose\":150}"));
        assertEquals(151.2, quote.price());
        assertEquals(150.0, quote.previousClose());
    }

    @Test
    @DisplayName("quote price falls back to previousClose when close is NA")
    void quotePriceFallback() throws Exception {
        Quote quote = ProviderRecordAdapter.toQuote("EURUSD.FOREX",
            json("{\"close\":\"NA\",\"previousClose\":1.0921}"));
        assertEquals(1.0921, quote.price());
        assertNull(quote.timestamp());
    }

    @Test
    @DisplayName("quote without any usable price → INVALID_RESPONSE")
    void quoteWithoutPrice() throws Exception {
        MarketDataException e = assertThrows(MarketDataException.class, () ->
            ProviderRecordAdapter.toQuote("X.US", json("{\"close\":\"NA\"}")));
        assertEquals(MarketDataErrorKind.INVALID_RESPONSE, e.getKind());
    }

    @Test
    @DisplayName("candle body that is not an array → INVALID_RESPONSE")
    void notAnArray() throws Exception {
        JsonNode body = json("{\"message\":\"Ticker Not Found\"}");
        MarketDataException e = assertThrows(MarketDataException.class, () ->
            ProviderRecordAdapter.fromIntraday(body));
        assertEquals(MarketDataErrorKind.INVALID_RESPONSE, e.getKind());
    }
}
