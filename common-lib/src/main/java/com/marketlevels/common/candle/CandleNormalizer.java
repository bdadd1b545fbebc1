package com.marketlevels.common.candle;

import com.marketlevels.common.model.Candle;
import com.marketlevels.common.model.NormalizationMode;
import com.marketlevels.common.model.RawCandle;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Converts {@link RawCandle} records into validated, time-ascending {@link Candle}s.
 *
 * <p>A record is dropped, never repaired, when:
 * <ul>
 *   <li>its timestamp is missing or unparseable</li>
 *   <li>any of open/high/low/close is missing, NaN or infinite</li>
 *   <li>any price is negative, or {@code high < low}</li>
 *   <li>volume is present but negative or non-finite (missing volume becomes 0)</li>
 *   <li>its timestamp repeats an earlier surviving record's timestamp</li>
 * </ul>
 *
 * <p>Survivors are sorted by time with a stable sort, so ties keep input order and
 * the first occurrence of a duplicate timestamp wins. Pure function.
 */
public final class CandleNormalizer {

    private static final DateTimeFormatter PLAIN_DATETIME =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private CandleNormalizer() {}

    public static List<Candle> normalize(List<RawCandle> raw, NormalizationMode mode) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }

        List<Candle> valid = new ArrayList<>(raw.size());
        for (RawCandle record : raw) {
            Candle candle = toCandle(record, mode);
            if (candle != null) {
                valid.add(candle);
            }
        }

        // List.sort is a stable merge sort
        valid.sort(Comparator.comparingLong(Candle::time));

        List<Candle> result = new ArrayList<>(valid.size());
        long previous = Long.MIN_VALUE;
        for (Candle candle : valid) {
            if (candle.time() != previous) {
                result.add(candle);
                previous = candle.time();
            }
        }
        return List.copyOf(result);
    }

    /** Number of input records {@link #normalize} would drop. */
    public static int countDropped(List<RawCandle> raw, List<Candle> normalized) {
        int in = raw == null ? 0 : raw.size();
        return in - (normalized == null ? 0 : normalized.size());
    }

    // ── per-record validation ──────────────────────────────────────────────

    static Candle toCandle(RawCandle record, NormalizationMode mode) {
        if (record == null) return null;

        Instant instant = parseTime(record);
        if (instant == null) return null;
        if (mode == NormalizationMode.DAILY) {
            instant = instant.truncatedTo(ChronoUnit.DAYS);
        }

        Double open  = record.open();
        Double high  = record.high();
        Double low   = record.low();
        Double close = record.close();
        if (!isValidPrice(open) || !isValidPrice(high) || !isValidPrice(low) || !isValidPrice(close)) {
            return null;
        }
        if (high < low) return null;

        double volume = 0.0;
        if (record.volume() != null) {
            volume = record.volume();
            if (!Double.isFinite(volume) || volume < 0) return null;
        }

        return new Candle(instant.getEpochSecond(), open, high, low, close, volume);
    }

    private static boolean isValidPrice(Double value) {
        return value != null && Double.isFinite(value) && value >= 0;
    }

    // ── timestamp parsing ──────────────────────────────────────────────────

    static Instant parseTime(RawCandle record) {
        if (record.epochMillis() != null) {
            return Instant.ofEpochMilli(record.epochMillis());
        }
        String text = record.timeText();
        if (text == null || text.isBlank()) {
            return null;
        }
        return parseText(text.trim());
    }

    private static Instant parseText(String text) {
        if (text.length() == 10) {
            return tryParse(() -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        Instant instant = tryParse(() -> OffsetDateTime.parse(text).toInstant());
        if (instant == null) {
            instant = tryParse(() -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        }
        if (instant == null) {
            instant = tryParse(() -> LocalDateTime.parse(text, PLAIN_DATETIME).toInstant(ZoneOffset.UTC));
        }
        return instant;
    }

    private static Instant tryParse(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
