package com.marketlevels.marketdata.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketlevels.common.exception.MarketDataErrorKind;
import com.marketlevels.common.exception.MarketDataException;
import com.marketlevels.common.model.RawCandle;
import com.marketlevels.marketdata.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * EODHD REST client. Every call authenticates with the {@code api_token} query
 * parameter and asks for JSON.
 *
 * <p>Failures reach callers as {@link MarketDataException}: transport errors, non-2xx
 * statuses and timeouts become {@code UPSTREAM_UNAVAILABLE}; bodies that are empty,
 * not JSON, or of the wrong shape become {@code INVALID_RESPONSE}.
 */
public class MarketDataWebClient {

    private static final Logger log = LoggerFactory.getLogger(MarketDataWebClient.class);

    private final WebClient    webClient;
    private final ObjectMapper objectMapper;
    private final String       apiToken;
    private final Duration     requestTimeout;

    public MarketDataWebClient(WebClient eodhdWebClient, ObjectMapper objectMapper,
                               String apiToken, Duration requestTimeout) {
        this.webClient      = eodhdWebClient;
        this.objectMapper   = objectMapper;
        this.apiToken       = apiToken;
        this.requestTimeout = requestTimeout;
    }

    public Mono<Quote> fetchQuote(String providerSymbol) {
        return get("real-time", providerSymbol, b -> b
                .path("/api/real-time/{symbol}"))
            .map(body -> ProviderRecordAdapter.toQuote(providerSymbol, body))
            .doOnSuccess(q -> log.info("Quote fetched. symbol={} price={}", providerSymbol, q.price()));
    }

    /** Daily bars for {@code [from, to]}, both inclusive. */
    public Mono<List<RawCandle>> fetchEndOfDay(String providerSymbol, LocalDate from, LocalDate to) {
        return get("eod", providerSymbol, b -> b
                .path("/api/eod/{symbol}")
                .queryParam("from", from)
                .queryParam("to", to)
                .queryParam("period", "d"))
            .map(ProviderRecordAdapter::fromEndOfDay)
            .doOnSuccess(records -> log.info("End-of-day fetched. symbol={} from={} to={} records={}",
                providerSymbol, from, to, records.size()));
    }

    /** Intraday bars at {@code interval}; the window is sent as unix seconds. */
    public Mono<List<RawCandle>> fetchIntraday(String providerSymbol, String interval,
                                               Instant from, Instant to) {
        return get("intraday", providerSymbol, b -> b
                .path("/api/intraday/{symbol}")
                .queryParam("interval", interval)
                .queryParam("from", from.getEpochSecond())
                .queryParam("to", to.getEpochSecond()))
            .map(ProviderRecordAdapter::fromIntraday)
            .doOnSuccess(records -> log.info("Intraday fetched. symbol={} interval={} records={}",
                providerSymbol, interval, records.size()));
    }

    /** Raw options chain; interpretation is left to {@link ImpliedVolatilityClient}. */
    public Mono<JsonNode> fetchOptionsChain(String providerSymbol) {
        return get("options", providerSymbol, b -> b
            .path("/api/options/{symbol}"));
    }

    // ── transport ───────────────────────────────────────────────────────────

    private Mono<JsonNode> get(String operation, String providerSymbol,
                               Function<UriBuilder, UriBuilder> path) {
        return webClient.get()
            .uri(b -> withAuth(path.apply(b), providerSymbol))
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(requestTimeout)
            .switchIfEmpty(Mono.error(() -> new MarketDataException(MarketDataErrorKind.INVALID_RESPONSE,
                "Empty " + operation + " response for symbol: " + providerSymbol)))
            .map(json -> readTree(operation, providerSymbol, json))
            .onErrorMap(e -> !(e instanceof MarketDataException),
                e -> translate(operation, providerSymbol, e))
            .doOnError(e -> log.warn("Upstream call failed. op={} symbol={} reason={}",
                operation, providerSymbol, e.getMessage()));
    }

    private URI withAuth(UriBuilder builder, String providerSymbol) {
        return builder
            .queryParam("api_token", apiToken)
            .queryParam("fmt", "json")
            .build(providerSymbol);
    }

    private JsonNode readTree(String operation, String providerSymbol, String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MarketDataException(MarketDataErrorKind.INVALID_RESPONSE,
                "Unparseable " + operation + " response for symbol: " + providerSymbol, e);
        }
    }

    static MarketDataException translate(String operation, String providerSymbol, Throwable e) {
        if (e instanceof WebClientResponseException wre) {
            return new MarketDataException(MarketDataErrorKind.UPSTREAM_UNAVAILABLE,
                operation + " returned HTTP " + wre.getStatusCode().value() + " for symbol: " + providerSymbol, e);
        }
        if (e instanceof WebClientRequestException || e instanceof TimeoutException) {
            return new MarketDataException(MarketDataErrorKind.UPSTREAM_UNAVAILABLE,
                operation + " unreachable for symbol: " + providerSymbol, e);
        }
        return new MarketDataException(MarketDataErrorKind.INVALID_RESPONSE,
            operation + " response could not be read for symbol: " + providerSymbol, e);
    }
}
