package com.marketlevels.marketdata.controller;

import com.marketlevels.common.exception.MarketDataErrorKind;
import com.marketlevels.common.exception.MarketDataException;
import com.marketlevels.common.model.ExpectedMoveHorizon;
import com.marketlevels.common.model.Timeframe;
import com.marketlevels.common.symbol.ResolutionError;
import com.marketlevels.common.symbol.ResolvedSymbol;
import com.marketlevels.common.symbol.SymbolResolution;
import com.marketlevels.marketdata.cache.MarketDataCache;
import com.marketlevels.marketdata.model.DateRange;
import com.marketlevels.marketdata.model.ExpectedMoveBatchRequest;
import com.marketlevels.marketdata.service.ExpectedMoveService;
import com.marketlevels.marketdata.service.MarketDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/market-data")
public class MarketDataController {

    private static final Logger log = LoggerFactory.getLogger(MarketDataController.class);

    private final MarketDataService   marketData;
    private final ExpectedMoveService expectedMove;
    private final MarketDataCache     cache;

    public MarketDataController(MarketDataService marketData, ExpectedMoveService expectedMove,
                                MarketDataCache cache) {
        this.marketData   = marketData;
        this.expectedMove = expectedMove;
        this.cache        = cache;
    }

    @GetMapping("/resolve")
    public ResponseEntity<Object> resolve(@RequestParam(required = false) String input) {
        SymbolResolution resolution = marketData.resolve(input);
        if (resolution instanceof ResolvedSymbol resolved) {
            return ResponseEntity.ok(resolved);
        }
        ResolutionError error = (ResolutionError) resolution;
        return ResponseEntity.status(statusOf(error.kind()))
            .<Object>body(errorBody(error.kind()));
    }

    @GetMapping("/candles/{symbol}")
    public Mono<ResponseEntity<Object>> getCandles(@PathVariable String symbol,
                                                   @RequestParam(defaultValue = "daily") String timeframe,
                                                   @RequestParam(required = false) String from,
                                                   @RequestParam(required = false) String to) {
        return respond(symbol, Mono.defer(() ->
            marketData.fetchCandles(symbol, parseTimeframe(timeframe),
                new DateRange(parseDate(from), parseDate(to)))));
    }

    @GetMapping("/quote/{symbol}")
    public Mono<ResponseEntity<Object>> getQuote(@PathVariable String symbol) {
        return respond(symbol, marketData.getQuote(symbol));
    }

    @GetMapping("/expected-move/{symbol}")
    public Mono<ResponseEntity<Object>> getExpectedMove(@PathVariable String symbol,
                                                        @RequestParam(defaultValue = "weekly") String timeframe,
                                                        @RequestParam(required = false) Integer customDays) {
        return respond(symbol, Mono.defer(() ->
            expectedMove.computeExpectedMove(symbol, parseHorizon(timeframe), customDays)));
    }

    @PostMapping("/expected-move/batch")
    public Mono<ResponseEntity<Object>> getExpectedMoveBatch(@RequestBody ExpectedMoveBatchRequest request) {
        return respond("batch", Mono.defer(() -> {
            if (request.symbols() == null || request.symbols().isEmpty()) {
                throw new MarketDataException(MarketDataErrorKind.INVALID_INPUT, "Batch has no symbols");
            }
            String horizon = request.timeframe() == null ? "weekly" : request.timeframe();
            return expectedMove.computeBatch(request.symbols(), parseHorizon(horizon), request.customDays());
        }));
    }

    @GetMapping("/levels/{symbol}")
    public Mono<ResponseEntity<Object>> getLevels(@PathVariable String symbol,
                                                  @RequestParam(defaultValue = "daily") String timeframe) {
        return respond(symbol, Mono.defer(() ->
            expectedMove.levelsFor(symbol, parseTimeframe(timeframe))));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache() {
        int size = cache.size();
        cache.clear();
        return ResponseEntity.ok(Map.of("cleared", size));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    // ── error mapping ───────────────────────────────────────────────────────

    static HttpStatus statusOf(MarketDataErrorKind kind) {
        return switch (kind) {
            case INVALID_INPUT, UNSUPPORTED -> HttpStatus.BAD_REQUEST;
            case NO_DATA                    -> HttpStatus.NOT_FOUND;
            case UPSTREAM_UNAVAILABLE       -> HttpStatus.SERVICE_UNAVAILABLE;
            case INVALID_RESPONSE           -> HttpStatus.BAD_GATEWAY;
        };
    }

    private <T> Mono<ResponseEntity<Object>> respond(String symbol, Mono<T> body) {
        return body
            .map(value -> ResponseEntity.ok().<Object>body(value))
            .onErrorResume(MarketDataException.class, e -> {
                log.warn("Request failed. symbol={} kind={} reason={}", symbol, e.getKind(), e.getMessage());
                return Mono.just(ResponseEntity.status(statusOf(e.getKind())).<Object>body(errorBody(e.getKind())));
            })
            .onErrorResume(e -> {
                log.error("Unexpected failure. symbol={}", symbol, e);
                return Mono.just(ResponseEntity.internalServerError()
                    .<Object>body(Map.of("error", "Internal server error")));
            });
    }

    private static Map<String, Object> errorBody(MarketDataErrorKind kind) {
        return Map.of("error", kind.publicMessage(), "kind", kind.name());
    }

    private static Timeframe parseTimeframe(String raw) {
        Timeframe timeframe = Timeframe.fromValue(raw);
        if (timeframe == null) {
            throw new MarketDataException(MarketDataErrorKind.INVALID_INPUT, "Unsupported timeframe: " + raw);
        }
        return timeframe;
    }

    private static ExpectedMoveHorizon parseHorizon(String raw) {
        ExpectedMoveHorizon horizon = ExpectedMoveHorizon.fromValue(raw);
        if (horizon == null) {
            throw new MarketDataException(MarketDataErrorKind.INVALID_INPUT, "Unsupported horizon: " + raw);
        }
        return horizon;
    }

    private static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new MarketDataException(MarketDataErrorKind.INVALID_INPUT, "Invalid date: " + raw, e);
        }
    }
}
