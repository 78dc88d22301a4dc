package in.tickbridge.feedrelay;

import in.tickbridge.domain.feed.DownstreamHandle;
import in.tickbridge.domain.feed.FeedClass;
import in.tickbridge.domain.feed.SymbolIdentity;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-session subscription bookkeeping.
 *
 * Invariant: a token is a key of {@code clientsByToken} iff it is a key of
 * {@code symbolByToken} iff its identity is in the detailed or touchline set.
 * A token has exactly one identity: the spelling that first subscribed it.
 * Other spellings that resolve to the same token are kept as aliases.
 * Every method holds the monitor for its whole body, so no thread observes a
 * partial mutation. Readers get copies.
 */
public final class SubscriptionIndex {

    public enum Release {
        /** No subscription for that symbol, or the handle was not registered. */
        NOT_SUBSCRIBED,
        /** Handle removed; other handles still hold the token. */
        HANDLE_REMOVED,
        /** Last handle removed; the token left every structure. */
        SYMBOL_RELEASED
    }

    private final Map<String, Set<DownstreamHandle>> clientsByToken = new HashMap<>();
    private final Map<String, SymbolIdentity> symbolByToken = new HashMap<>();
    private final Set<SymbolIdentity> detailedSymbols = new LinkedHashSet<>();
    private final Set<SymbolIdentity> touchlineSymbols = new LinkedHashSet<>();
    private final Map<String, String> tokenByAlias = new HashMap<>();

    /**
     * Register {@code handle} for {@code symbol} under {@code feedClass}.
     *
     * @return true if the identity is new to that class's set, i.e. a
     *         re-subscription frame is due
     */
    public synchronized boolean register(SymbolIdentity symbol, DownstreamHandle handle, FeedClass feedClass) {
        String token = symbol.wireToken();
        SymbolIdentity canonical = symbolByToken.computeIfAbsent(token, k -> symbol);
        tokenByAlias.put(aliasKey(symbol.tradingSymbol(), symbol.exchange()), token);
        clientsByToken.computeIfAbsent(token, k -> new LinkedHashSet<>()).add(handle);
        return classSet(feedClass).add(canonical);
    }

    /**
     * Remove {@code handle} from the token that {@code (tradingSymbol, exchange)}
     * was subscribed under, whichever spelling was used. The last handle out
     * takes the token with it.
     */
    public synchronized Release release(String tradingSymbol, String exchange, DownstreamHandle handle) {
        String token = tokenByAlias.get(aliasKey(tradingSymbol, exchange));
        if (token == null) {
            return Release.NOT_SUBSCRIBED;
        }
        return releaseToken(token, handle);
    }

    /**
     * Remove {@code handle} from {@code token}.
     */
    public synchronized Release releaseToken(String token, DownstreamHandle handle) {
        SymbolIdentity symbol = symbolByToken.get(token);
        if (symbol == null) {
            return Release.NOT_SUBSCRIBED;
        }

        Set<DownstreamHandle> handles = clientsByToken.get(token);
        if (handles == null || !handles.remove(handle)) {
            return Release.NOT_SUBSCRIBED;
        }
        if (!handles.isEmpty()) {
            return Release.HANDLE_REMOVED;
        }

        clientsByToken.remove(token);
        symbolByToken.remove(token);
        // class membership is not tracked per token
        detailedSymbols.remove(symbol);
        touchlineSymbols.remove(symbol);
        tokenByAlias.values().removeIf(token::equals);
        return Release.SYMBOL_RELEASED;
    }

    /**
     * @return snapshot of handles for the token, empty if none
     */
    public synchronized List<DownstreamHandle> handlesFor(String token) {
        Set<DownstreamHandle> handles = clientsByToken.get(token);
        return handles == null ? List.of() : List.copyOf(handles);
    }

    public synchronized Optional<SymbolIdentity> symbolFor(String token) {
        return Optional.ofNullable(symbolByToken.get(token));
    }

    /**
     * @return snapshot of the class set in subscription order
     */
    public synchronized Set<SymbolIdentity> members(FeedClass feedClass) {
        return new LinkedHashSet<>(classSet(feedClass));
    }

    public synchronized boolean hasSubscribers(String token) {
        return clientsByToken.containsKey(token);
    }

    public synchronized int tokenCount() {
        return clientsByToken.size();
    }

    public synchronized int handleCount(String token) {
        Set<DownstreamHandle> handles = clientsByToken.get(token);
        return handles == null ? 0 : handles.size();
    }

    public synchronized boolean isEmpty() {
        return clientsByToken.isEmpty();
    }

    private static String aliasKey(String tradingSymbol, String exchange) {
        return exchange + "|" + tradingSymbol;
    }

    private Set<SymbolIdentity> classSet(FeedClass feedClass) {
        return feedClass == FeedClass.DETAILED ? detailedSymbols : touchlineSymbols;
    }
}
