package in.tickbridge.infrastructure.broker.instrument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers successful resolutions. Wire tokens are exchange-wide, so entries
 * are shared across credentials. Misses go to the delegate every time.
 */
public final class CachingSymbolResolver implements SymbolResolver {
    private static final Logger log = LoggerFactory.getLogger(CachingSymbolResolver.class);

    private record Key(String exchange, String symbol) {}

    private final SymbolResolver delegate;
    private final Map<Key, String> tokens = new ConcurrentHashMap<>();

    public CachingSymbolResolver(SymbolResolver delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<String> resolve(String credential, String humanSymbol, String exchange) {
        Key key = new Key(exchange.toUpperCase(Locale.ROOT), humanSymbol.toUpperCase(Locale.ROOT));
        String cached = tokens.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }

        Optional<String> resolved = delegate.resolve(credential, humanSymbol, exchange);
        resolved.ifPresent(token -> {
            tokens.put(key, token);
            log.debug("[RESOLVER] Cached {}:{} -> {}", exchange, humanSymbol, token);
        });
        return resolved;
    }

    public int size() {
        return tokens.size();
    }

    public void clear() {
        tokens.clear();
    }
}
