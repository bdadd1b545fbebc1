package com.marketlevels.common.symbol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketlevels.common.model.AssetClass;

public record ResolvedSymbol(
    @JsonProperty("userInput")      String     userInput,
    @JsonProperty("providerSymbol") String     providerSymbol,
    @JsonProperty("assetClass")     AssetClass assetClass
) implements SymbolResolution {

    @Override
    public boolean isResolved() {
        return true;
    }
}
