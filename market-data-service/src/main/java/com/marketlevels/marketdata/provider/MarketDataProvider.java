package com.marketlevels.marketdata.provider;

import com.marketlevels.common.model.Timeframe;
import com.marketlevels.marketdata.model.ChartData;
import com.marketlevels.marketdata.model.DateRange;
import com.marketlevels.marketdata.model.Quote;
import reactor.core.publisher.Mono;

/**
 * Candle and quote access by user-facing symbol. Errors are signalled as
 * {@link com.marketlevels.common.exception.MarketDataException}.
 */
public interface MarketDataProvider {

    Mono<ChartData> fetchCandles(String userSymbol, Timeframe timeframe, DateRange range);

    Mono<Quote> getQuote(String userSymbol);
}
