package in.tickbridge.domain.feed;

import java.util.Objects;

/**
 * Instrument as known to the upstream feed.
 * Two independent resolutions of the same instrument are equal, so they collapse
 * to one subscription when held in a set.
 */
public record SymbolIdentity(
    String exchange,
    String wireToken,
    String tradingSymbol
) {
    private static final String[] SERIES_SUFFIXES = {"-EQ", "-BE", "-BL"};

    public SymbolIdentity {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(wireToken, "wireToken");
        Objects.requireNonNull(tradingSymbol, "tradingSymbol");
    }

    /**
     * Exchange-qualified symbol, e.g. {@code NSE|TCS-EQ}.
     */
    public String formattedSymbol() {
        return exchange + "|" + tradingSymbol;
    }

    /**
     * Wire subscription key, e.g. {@code NSE|11536}.
     */
    public String subscriptionKey() {
        return exchange + "|" + wireToken;
    }

    /**
     * Trading symbol without its series suffix ({@code TCS-EQ -> TCS}).
     */
    public String displaySymbol() {
        return stripSeries(tradingSymbol);
    }

    public static String stripSeries(String symbol) {
        for (String suffix : SERIES_SUFFIXES) {
            if (symbol.endsWith(suffix)) {
                return symbol.substring(0, symbol.length() - suffix.length());
            }
        }
        return symbol;
    }
}
