package com.marketlevels.common.model;

/**
 * Instrument class of a resolved symbol. Each class owns exactly one
 * provider suffix; a provider symbol always ends with the suffix of its class.
 */
public enum AssetClass {
    EQUITY(".US"),
    CRYPTO("-USD.CC"),
    FOREX(".FOREX");

    private final String suffix;

    AssetClass(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /** Returns the class whose suffix terminates {@code providerSymbol}, or {@code null}. */
    public static AssetClass fromProviderSymbol(String providerSymbol) {
        if (providerSymbol == null) return null;
        for (AssetClass assetClass : values()) {
            if (providerSymbol.endsWith(assetClass.suffix)) {
                return assetClass;
            }
        }
        return null;
    }
}
