package com.marketlevels.marketdata.model;

import com.marketlevels.common.exception.MarketDataErrorKind;
import com.marketlevels.common.exception.MarketDataException;

import java.time.LocalDate;

/**
 * Inclusive date window for an upstream query. Either bound may be {@code null};
 * {@link #resolve(LocalDate, int)} fills the gaps from today and a lookback.
 */
public record DateRange(LocalDate from, LocalDate to) {

    public static DateRange unbounded() {
        return new DateRange(null, null);
    }

    /**
     * Returns a fully bounded range: a missing {@code to} becomes {@code today},
     * a missing {@code from} becomes {@code to - lookbackDays}.
     *
     * @throws MarketDataException {@code INVALID_INPUT} when {@code from} is after {@code to}
     */
    public DateRange resolve(LocalDate today, int lookbackDays) {
        LocalDate end   = to != null ? to : today;
        LocalDate start = from != null ? from : end.minusDays(lookbackDays);
        if (start.isAfter(end)) {
            throw new MarketDataException(MarketDataErrorKind.INVALID_INPUT,
                "Range start " + start + " is after end " + end);
        }
        return new DateRange(start, end);
    }

    @Override
    public String toString() {
        return from + ".." + to;
    }
}
