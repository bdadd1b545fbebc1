package com.marketlevels.common.symbol;

/**
 * Outcome of {@link SymbolResolver#resolve(String)}: either a {@link ResolvedSymbol}
 * or a {@link ResolutionError}. Resolution never throws.
 */
public sealed interface SymbolResolution permits ResolvedSymbol, ResolutionError {

    boolean isResolved();
}
