package com.marketlevels.common.exception;

public class MarketDataException extends RuntimeException {
    private final MarketDataErrorKind kind;

    public MarketDataException(MarketDataErrorKind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public MarketDataException(MarketDataErrorKind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public MarketDataErrorKind getKind() {
        return kind;
    }

    public static MarketDataException noData(String providerSymbol) {
        return new MarketDataException(MarketDataErrorKind.NO_DATA,
            "No usable candles for symbol: " + providerSymbol);
    }
}
