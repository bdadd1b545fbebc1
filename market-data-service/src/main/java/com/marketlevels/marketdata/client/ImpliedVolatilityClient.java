package com.marketlevels.marketdata.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketlevels.common.model.AssetClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives an at-the-money implied volatility from the EODHD options chain.
 *
 * <p>Best effort: only equities are queried, and any upstream or parsing failure
 * yields {@link Optional#empty()} so the expected-move path falls back to the next
 * volatility estimator instead of failing.
 */
@Component
public class ImpliedVolatilityClient {

    private static final Logger log = LoggerFactory.getLogger(ImpliedVolatilityClient.class);

    /** Strikes within this fraction of the close count as at-the-money. */
    static final double ATM_BAND = 0.05;

    /** Chains quoting IV in percent (25.3) rather than as a fraction (0.253). */
    private static final double PERCENT_THRESHOLD = 5.0;

    private final MarketDataWebClient client;

    public ImpliedVolatilityClient(MarketDataWebClient client) {
        this.client = client;
    }

    /**
     * @param providerSymbol resolved symbol
     * @param assetClass     asset class of {@code providerSymbol}
     * @param close          reference price for the at-the-money band
     * @return average IV of at-the-money options as an annualized fraction, or empty
     */
    public Mono<Optional<Double>> fetchAtTheMoneyIv(String providerSymbol, AssetClass assetClass, double close) {
        if (assetClass != AssetClass.EQUITY) {
            return Mono.just(Optional.empty());
        }
        return client.fetchOptionsChain(providerSymbol)
            .map(chain -> averageAtTheMoneyIv(chain, close))
            .doOnNext(iv -> log.debug("Options IV. symbol={} iv={}", providerSymbol, iv.orElse(null)))
            .onErrorResume(e -> {
                log.warn("Options IV unavailable for symbol={}, falling back. reason={}",
                         providerSymbol, e.getMessage());
                return Mono.just(Optional.empty());
            });
    }

    /**
     * Accepts both flat chains ({@code data[] = {strike, impliedVolatility}}) and chains
     * grouped by expiry ({@code data[].options.CALL[] / PUT[]}).
     */
    static Optional<Double> averageAtTheMoneyIv(JsonNode chain, double close) {
        List<JsonNode> contracts = new ArrayList<>();
        JsonNode data = chain == null ? null : chain.path("data");
        if (data == null || !data.isArray()) {
            return Optional.empty();
        }
        for (JsonNode item : data) {
            if (item.has("strike")) {
                contracts.add(item);
                continue;
            }
            JsonNode options = item.path("options");
            for (String side : new String[]{"CALL", "PUT"}) {
                options.path(side).forEach(contracts::add);
            }
        }

        double sum   = 0;
        int    count = 0;
        for (JsonNode contract : contracts) {
            Double strike = ProviderRecordAdapter.number(contract, "strike");
            Double iv     = ProviderRecordAdapter.number(contract, "impliedVolatility", "volatility");
            if (strike == null || iv == null || !Double.isFinite(iv) || iv <= 0) continue;
            if (Math.abs(strike - close) >= close * ATM_BAND) continue;
            sum += iv > PERCENT_THRESHOLD ? iv / 100.0 : iv;
            count++;
        }
        return count == 0 ? Optional.empty() : Optional.of(sum / count);
    }
}
