package in.tickbridge.infrastructure.broker.instrument;

import java.util.Optional;

/**
 * Maps a human trading symbol to the broker's wire token.
 */
@FunctionalInterface
public interface SymbolResolver {

    /**
     * @param credential session token used to query the broker
     * @param humanSymbol symbol as typed by the viewer, e.g. {@code TCS-EQ} or {@code TCS}
     * @param exchange exchange code, e.g. {@code NSE}
     * @return the wire token, or empty if the instrument is unknown
     */
    Optional<String> resolve(String credential, String humanSymbol, String exchange);
}
