package com.marketlevels.common.symbol;

import com.marketlevels.common.model.AssetClass;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps free-form user input (ticker, common name, alias) to exactly one provider symbol.
 *
 * <p>Rules, evaluated in priority order:
 * <ol>
 *   <li>null or blank input → {@code INVALID_INPUT}</li>
 *   <li>input already carrying a provider suffix ({@code .US}, {@code -USD.CC},
 *       {@code .FOREX}) → returned as-is, after collapsing repeated suffixes</li>
 *   <li>alias table hit ({@code bitcoin}, {@code gold}, {@code btc/usd}, …) → aliased symbol</li>
 *   <li>bare ticker ({@code AAPL}, {@code BRK.B}) → equity, {@code .US} appended</li>
 *   <li>otherwise → {@code UNSUPPORTED}</li>
 * </ol>
 *
 * <p>Resolving an already-resolved provider symbol returns it unchanged.
 * No logging. No side-effects.
 */
public final class SymbolResolver {

    private static final Pattern BARE_TICKER = Pattern.compile("^[A-Z][A-Z0-9]{0,5}([.-][A-Z])?$");
    private static final Pattern STEM        = Pattern.compile("^[\\p{L}\\p{N}][\\p{L}\\p{N}._-]*$");

    private static final Pattern REPEATED_CRYPTO = Pattern.compile("(-USD)+(\\.CC)+$");
    private static final Pattern REPEATED_EQUITY = Pattern.compile("(\\.US){2,}$");
    private static final Pattern REPEATED_FOREX  = Pattern.compile("(\\.FOREX){2,}$");

    private SymbolResolver() {}

    public static SymbolResolution resolve(String input) {
        if (input == null || input.isBlank()) {
            return ResolutionError.invalidInput(input);
        }

        String cleaned = repairSuffixes(input.trim().toUpperCase(Locale.ROOT));

        // ── already a provider symbol ──────────────────────────────────────
        AssetClass suffixed = AssetClass.fromProviderSymbol(cleaned);
        if (suffixed != null) {
            String stem = cleaned.substring(0, cleaned.length() - suffixed.suffix().length());
            if (!STEM.matcher(stem).matches() || AssetClass.fromProviderSymbol(stem) != null) {
                return ResolutionError.unsupported(input);
            }
            return new ResolvedSymbol(input, cleaned, suffixed);
        }

        // ── alias table ────────────────────────────────────────────────────
        String aliased = SymbolAliases.lookup(cleaned);
        if (aliased != null) {
            return new ResolvedSymbol(input, aliased, AssetClass.fromProviderSymbol(aliased));
        }

        // ── equity fallback ────────────────────────────────────────────────
        if (BARE_TICKER.matcher(cleaned).matches()) {
            return new ResolvedSymbol(input, cleaned + AssetClass.EQUITY.suffix(), AssetClass.EQUITY);
        }

        return ResolutionError.unsupported(input);
    }

    static String repairSuffixes(String cleaned) {
        String repaired = REPEATED_CRYPTO.matcher(cleaned).replaceAll("-USD.CC");
        repaired = REPEATED_EQUITY.matcher(repaired).replaceAll(".US");
        return REPEATED_FOREX.matcher(repaired).replaceAll(".FOREX");
    }
}
