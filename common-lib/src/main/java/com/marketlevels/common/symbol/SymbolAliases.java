package com.marketlevels.common.symbol;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Static alias table: common names, spellings and pair notations mapped to
 * a provider symbol. Keys are stored in compact form (upper-case, letters and
 * digits only), see {@link #compact(String)}.
 */
final class SymbolAliases {

    private static final Map<String, String> ALIASES = build();

    private SymbolAliases() {}

    static String lookup(String input) {
        return ALIASES.get(compact(input));
    }

    static String compact(String input) {
        return input.toUpperCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
    }

    private static Map<String, String> build() {
        Map<String, String> m = new HashMap<>();

        // ── crypto tickers, with their USD pair form ───────────────────────────
        for (String ticker : new String[] {
                "BTC", "ETH", "SOL", "XRP", "ADA", "DOT", "LINK", "AVAX", "MATIC", "UNI",
                "DOGE", "LTC", "BNB", "BCH", "AXS", "SAND", "MANA", "ALGO", "ATOM", "NEAR", "FTM"}) {
            crypto(m, ticker, ticker);
            crypto(m, ticker + "USD", ticker);
        }

        // ── crypto names ───────────────────────────────────────────────────────
        crypto(m, "BITCOIN", "BTC");
        crypto(m, "ETHEREUM", "ETH");
        crypto(m, "ETHERIUM", "ETH");
        crypto(m, "ETHERUM", "ETH");
        crypto(m, "SOLANA", "SOL");
        crypto(m, "RIPPLE", "XRP");
        crypto(m, "CARDANO", "ADA");
        crypto(m, "POLKADOT", "DOT");
        crypto(m, "CHAINLINK", "LINK");
        crypto(m, "AVALANCHE", "AVAX");
        crypto(m, "POLYGON", "MATIC");
        crypto(m, "UNISWAP", "UNI");
        crypto(m, "DOGECOIN", "DOGE");
        crypto(m, "LITECOIN", "LTC");
        crypto(m, "BINANCE", "BNB");
        crypto(m, "BINANCECOIN", "BNB");

        // Arabic
        crypto(m, "بيتكوين", "BTC");
        crypto(m, "إيثريوم", "ETH");
        crypto(m, "ريبل", "XRP");
        crypto(m, "لايتكوين", "LTC");
        crypto(m, "دوجكوين", "DOGE");

        // ── metals ─────────────────────────────────────────────────────────────
        forex(m, "GOLD", "XAUUSD");
        forex(m, "XAU", "XAUUSD");
        forex(m, "XAUUSD", "XAUUSD");
        forex(m, "SILVER", "XAGUSD");
        forex(m, "XAG", "XAGUSD");
        forex(m, "XAGUSD", "XAGUSD");
        forex(m, "ذهب", "XAUUSD");
        forex(m, "فضة", "XAGUSD");

        // ── forex pairs ────────────────────────────────────────────────────────
        for (String pair : new String[] {
                "EURUSD", "GBPUSD", "USDJPY", "USDCHF", "AUDUSD", "USDCAD",
                "NZDUSD", "EURGBP", "EURJPY"}) {
            forex(m, pair, pair);
        }
        return Map.copyOf(m);
    }

    private static void crypto(Map<String, String> m, String alias, String base) {
        m.put(compact(alias), base + "-USD.CC");
    }

    private static void forex(Map<String, String> m, String alias, String pair) {
        m.put(compact(alias), pair + ".FOREX");
    }
}
