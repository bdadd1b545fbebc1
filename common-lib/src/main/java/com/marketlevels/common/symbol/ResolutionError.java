package com.marketlevels.common.symbol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketlevels.common.exception.MarketDataErrorKind;
import com.marketlevels.common.exception.MarketDataException;

/**
 * Why an input could not be resolved. {@code kind} is either
 * {@link MarketDataErrorKind#INVALID_INPUT} or {@link MarketDataErrorKind#UNSUPPORTED}.
 */
public record ResolutionError(
    @JsonProperty("userInput") String              userInput,
    @JsonProperty("kind")      MarketDataErrorKind kind,
    @JsonProperty("reason")    String              reason
) implements SymbolResolution {

    static ResolutionError invalidInput(String userInput) {
        return new ResolutionError(userInput, MarketDataErrorKind.INVALID_INPUT,
            MarketDataErrorKind.INVALID_INPUT.publicMessage());
    }

    static ResolutionError unsupported(String userInput) {
        return new ResolutionError(userInput, MarketDataErrorKind.UNSUPPORTED,
            MarketDataErrorKind.UNSUPPORTED.publicMessage());
    }

    @Override
    public boolean isResolved() {
        return false;
    }

    public MarketDataException toException() {
        return new MarketDataException(kind, reason + ": " + userInput);
    }
}
