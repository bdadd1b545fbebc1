package com.marketlevels.common.exception;

/**
 * Failure categories surfaced to callers. Each kind carries a fixed user-safe
 * message; provider error text is never exposed.
 */
public enum MarketDataErrorKind {
    INVALID_INPUT("Invalid symbol input"),
    UNSUPPORTED("Unsupported symbol"),
    NO_DATA("No data available for this symbol"),
    UPSTREAM_UNAVAILABLE("Market data service temporarily unavailable"),
    INVALID_RESPONSE("Market data provider returned an invalid response");

    private final String publicMessage;

    MarketDataErrorKind(String publicMessage) {
        this.publicMessage = publicMessage;
    }

    public String publicMessage() {
        return publicMessage;
    }
}
