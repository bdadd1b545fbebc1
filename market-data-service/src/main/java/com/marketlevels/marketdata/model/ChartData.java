package com.marketlevels.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketlevels.common.model.AssetClass;
import com.marketlevels.common.model.Candle;
import com.marketlevels.common.model.CandleSeries;

import java.util.List;

public record ChartData(
    @JsonProperty("symbol")     String       symbol,
    @JsonProperty("assetClass") AssetClass   assetClass,
    @JsonProperty("timeframe")  String       timeframe,
    @JsonProperty("candles")    List<Candle> candles,
    @JsonProperty("lastPrice")  Double       lastPrice
) {
    public static ChartData of(CandleSeries series, AssetClass assetClass) {
        return new ChartData(series.providerSymbol(), assetClass, series.timeframe().value(),
            series.candles(), series.lastPrice());
    }
}
