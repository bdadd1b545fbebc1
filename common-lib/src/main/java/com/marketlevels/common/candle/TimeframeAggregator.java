package com.marketlevels.common.candle;

import com.marketlevels.common.model.AggregationPeriod;
import com.marketlevels.common.model.Candle;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolls a time-ascending series into coarser bars: intraday bars into 15-minute or
 * 4-hour bars, daily bars into weekly or monthly ones.
 *
 * <p>Fixed-width buckets are aligned to the UTC epoch (4-hour buckets start at
 * 00:00, 04:00, … UTC). Weekly buckets start on Monday 00:00 UTC and monthly buckets
 * on the 1st of the month, both derived from each candle's own UTC date. Within a bucket:
 * open = first open, close = last close, high = max high, low = min low,
 * volume = sum, time = first candle's time.
 *
 * <p>Single O(n) pass; a bucket is emitted when the next candle opens a new bucket or when
 * the input is exhausted. Empty input yields an empty list.
 */
public final class TimeframeAggregator {

    private TimeframeAggregator() {}

    public static List<Candle> aggregate(List<Candle> candles, AggregationPeriod period) {
        if (candles == null || candles.isEmpty()) {
            return List.of();
        }

        List<Candle> bars = new ArrayList<>();
        Bucket current = null;

        for (Candle candle : candles) {
            long start = bucketStart(candle.time(), period);
            if (current == null || current.start != start) {
                if (current != null) {
                    bars.add(current.toCandle());
                }
                current = new Bucket(start, candle);
            } else {
                current.add(candle);
            }
        }
        bars.add(current.toCandle());
        return List.copyOf(bars);
    }

    /** Start of the bucket holding {@code epochSeconds}, in epoch seconds. */
    static long bucketStart(long epochSeconds, AggregationPeriod period) {
        if (period.widthSeconds() > 0) {
            return Math.floorDiv(epochSeconds, period.widthSeconds()) * period.widthSeconds();
        }
        LocalDate date = Instant.ofEpochSecond(epochSeconds).atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate start = switch (period) {
            case WEEKLY -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            default     -> date.withDayOfMonth(1);
        };
        return start.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }

    // ── mutable accumulator, local to one aggregate() call ─────────────────

    private static final class Bucket {
        private final long   start;
        private final long   time;
        private final double open;
        private double high;
        private double low;
        private double close;
        private double volume;

        Bucket(long start, Candle first) {
            this.start  = start;
            this.time   = first.time();
            this.open   = first.open();
            this.high   = first.high();
            this.low    = first.low();
            this.close  = first.close();
            this.volume = first.volume();
        }

        void add(Candle candle) {
            high    = Math.max(high, candle.high());
            low     = Math.min(low, candle.low());
            close   = candle.close();
            volume += candle.volume();
        }

        Candle toCandle() {
            return new Candle(time, open, high, low, close, volume);
        }
    }
}
