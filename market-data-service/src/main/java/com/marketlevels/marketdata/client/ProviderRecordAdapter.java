package com.marketlevels.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketlevels.common.exception.MarketDataErrorKind;
import com.marketlevels.common.exception.MarketDataException;
import com.marketlevels.common.model.RawCandle;
import com.marketlevels.marketdata.model.Quote;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps upstream JSON records onto {@link RawCandle} / {@link Quote}, one adapter per
 * endpoint kind. Field names vary across endpoints, so every OHLCV field accepts
 * its long and short name ({@code open}/{@code o}, …). Numbers may arrive as JSON
 * numbers or strings; anything unparseable ({@code "NA"}) becomes {@code null} and
 * is left for the normalizer to drop.
 */
public final class ProviderRecordAdapter {

    private ProviderRecordAdapter() {}

    // ── end-of-day: {"date":"2024-01-02","open":..,"high":..,"low":..,"close":..,"volume":..}

    public static List<RawCandle> fromEndOfDay(JsonNode body) {
        List<RawCandle> records = new ArrayList<>();
        for (JsonNode node : requireArray(body)) {
            String text = text(node, "date", "datetime");
            Long millis = text != null ? null : epochMillis(node);
            records.add(toRaw(node, millis, text));
        }
        return records;
    }

    // ── intraday: {"timestamp":1704205800,"datetime":"2024-01-02 14:30:00",...}

    public static List<RawCandle> fromIntraday(JsonNode body) {
        List<RawCandle> records = new ArrayList<>();
        for (JsonNode node : requireArray(body)) {
            Long millis = epochMillis(node);
            String text = millis != null ? null : text(node, "datetime", "date");
            records.add(toRaw(node, millis, text));
        }
        return records;
    }

    // ── real-time: {"code":"AAPL.US","timestamp":..,"close":..,"previousClose":..,...}

    public static Quote toQuote(String providerSymbol, JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new MarketDataException(MarketDataErrorKind.INVALID_RESPONSE,
                "Quote body is not an object for symbol: " + providerSymbol);
        }
        Double price = positive(body, "close", "c", "price", "last", "previousClose");
        if (price == null) {
            throw new MarketDataException(MarketDataErrorKind.INVALID_RESPONSE,
                "Quote has no usable price for symbol: " + providerSymbol);
        }
        Double epochSeconds = number(body, "timestamp");
        Instant timestamp = epochSeconds != null && Double.isFinite(epochSeconds)
            ? Instant.ofEpochSecond(epochSeconds.longValue())
            : null;
        return new Quote(
            providerSymbol,
            price,
            number(body, "open", "o"),
            number(body, "high", "h"),
            number(body, "low", "l"),
            number(body, "previousClose"),
            number(body, "change"),
            number(body, "change_p", "changePercent"),
            number(body, "volume", "v"),
            timestamp
        );
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static JsonNode requireArray(JsonNode body) {
        if (body == null || !body.isArray()) {
            throw new MarketDataException(MarketDataErrorKind.INVALID_RESPONSE,
                "Expected a JSON array of candles but got: "
                    + (body == null ? "nothing" : body.getNodeType()));
        }
        return body;
    }

    private static RawCandle toRaw(JsonNode node, Long millis, String text) {
        return new RawCandle(
            millis,
            text,
            number(node, "open", "o"),
            number(node, "high", "h"),
            number(node, "low", "l"),
            number(node, "close", "c"),
            number(node, "volume", "v")
        );
    }

    /** {@code timestamp} is epoch seconds; the short {@code t} is epoch millis. */
    static Long epochMillis(JsonNode node) {
        JsonNode seconds = node.get("timestamp");
        if (seconds != null && seconds.isNumber()) {
            return seconds.asLong() * 1000L;
        }
        JsonNode millis = node.get("t");
        if (millis != null && millis.isNumber()) {
            return millis.asLong();
        }
        return null;
    }

    static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    /** First alias holding a finite number; unparseable aliases are skipped. */
    static Double number(JsonNode node, String... names) {
        for (String name : names) {
            Double parsed = parse(node.get(name));
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    /** First alias holding a number above zero; a zero close falls through to the next alias. */
    static Double positive(JsonNode node, String... names) {
        for (String name : names) {
            Double parsed = parse(node.get(name));
            if (parsed != null && parsed > 0) {
                return parsed;
            }
        }
        return null;
    }

    private static Double parse(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        double parsed;
        if (value.isNumber()) {
            parsed = value.doubleValue();
        } else if (value.isTextual()) {
            try {
                parsed = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(parsed) ? parsed : null;
    }
}
