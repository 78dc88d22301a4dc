package in.tickbridge.feedrelay;

import com.fasterxml.jackson.databind.JsonNode;
import in.tickbridge.domain.feed.DownstreamHandle;
import in.tickbridge.domain.feed.FeedClass;
import in.tickbridge.domain.feed.SymbolIdentity;
import in.tickbridge.infrastructure.broker.data.FeedNotConnectedException;
import in.tickbridge.infrastructure.broker.data.SymbolResolutionException;
import in.tickbridge.infrastructure.broker.flattrade.FeedProtocol;
import in.tickbridge.infrastructure.broker.flattrade.UpstreamLink;
import in.tickbridge.infrastructure.broker.instrument.SymbolResolver;
import in.tickbridge.infrastructure.broker.metrics.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One credential's view of the feed: an upstream link plus the subscriptions
 * riding on it.
 *
 * Lifecycle:
 * 1. connectOrReuse() - handshake (serialized by the connect gate)
 * 2. subscribe() / unsubscribe() - per viewer
 * 3. [ticks arrive on the link's receive thread and are broadcast]
 * 4. close() - link down; subscriptions are kept for a later reconnect
 */
public final class FeedSession implements UpstreamLink.Listener {
    private static final Logger log = LoggerFactory.getLogger(FeedSession.class);

    private final String userId;
    private final String credential;
    private final UpstreamLink link;
    private final SubscriptionIndex index;
    private final SymbolResolver resolver;
    private final TickBroadcaster broadcaster;
    private final RelayMetrics metrics;
    private final ReentrantLock connectGate = new ReentrantLock();

    public FeedSession(String userId, String credential, UpstreamLink link, SymbolResolver resolver,
                       Clock clock, RelayMetrics metrics) {
        this.userId = userId;
        this.credential = credential;
        this.link = link;
        this.resolver = resolver;
        this.metrics = metrics;
        this.index = new SubscriptionIndex();
        this.broadcaster = new TickBroadcaster(index, this::evict, clock, metrics);
        link.setListener(this);
    }

    /**
     * Ensure the upstream link is connected. Concurrent callers wait on the gate
     * instead of opening a second connection. A fresh connection carries no
     * subscriptions, so every retained symbol is re-sent on it.
     *
     * @return true if connected; false if the handshake failed
     */
    public boolean connectOrReuse() {
        connectGate.lock();
        try {
            if (link.isConnected()) {
                log.debug("[SESSION:{}] Already connected", userId);
                return true;
            }
            if (!link.connect()) {
                return false;
            }
            if (!index.isEmpty()) {
                log.info("[SESSION:{}] Connected; replaying {} subscribed tokens", userId, index.tokenCount());
                sendSubscription(FeedClass.DETAILED);
                sendSubscription(FeedClass.TOUCHLINE);
            }
            return true;
        } finally {
            connectGate.unlock();
        }
    }

    /**
     * Subscribe {@code handle} to {@code humanSymbol} on {@code exchange}.
     *
     * @throws FeedNotConnectedException if the link is down
     * @throws SymbolResolutionException if the symbol has no wire token
     */
    public void subscribe(String humanSymbol, DownstreamHandle handle, String exchange, FeedClass feedClass) {
        if (!link.isConnected()) {
            throw new FeedNotConnectedException(UpstreamLink.BROKER_CODE, userId, "Not connected to FlatTrade");
        }

        Optional<String> token = resolver.resolve(credential, humanSymbol, exchange);
        if (token.isEmpty()) {
            throw new SymbolResolutionException(UpstreamLink.BROKER_CODE, userId, humanSymbol, exchange,
                "Invalid symbol");
        }

        SymbolIdentity symbol = new SymbolIdentity(exchange, token.get(), humanSymbol);
        boolean newToClass = index.register(symbol, handle, feedClass);

        log.info("[SESSION:{}] {} subscribed to {} (token={}, class={}), clients: {}",
            userId, handle.id(), symbol.formattedSymbol(), symbol.wireToken(), feedClass.label(),
            index.handleCount(symbol.wireToken()));

        if (newToClass) {
            sendSubscription(feedClass);
        }
    }

    /**
     * Remove {@code handle} from {@code humanSymbol}. Unknown symbols and handles are ignored.
     */
    public void unsubscribe(String humanSymbol, DownstreamHandle handle, String exchange) {
        SubscriptionIndex.Release release = index.release(humanSymbol, exchange, handle);
        switch (release) {
            case NOT_SUBSCRIBED -> log.debug("[SESSION:{}] {} not subscribed to {}|{}",
                userId, handle.id(), exchange, humanSymbol);
            case HANDLE_REMOVED -> log.info("[SESSION:{}] {} left {}|{}", userId, handle.id(), exchange, humanSymbol);
            case SYMBOL_RELEASED -> {
                log.info("[SESSION:{}] Unsubscribed {}|{}", userId, exchange, humanSymbol);
                sendSubscription(FeedClass.DETAILED);
                sendSubscription(FeedClass.TOUCHLINE);
            }
        }
    }

    /**
     * Close the upstream link. Subscriptions are retained.
     */
    public void close() {
        link.close();
    }

    /**
     * Close the link for good; used when the registry evicts this session.
     */
    public void shutdown() {
        link.shutdown();
    }

    public boolean isConnected() {
        return link.isConnected();
    }

    public String getUserId() {
        return userId;
    }

    SubscriptionIndex index() {
        return index;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // UPSTREAM CALLBACKS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void onFrame(JsonNode frame) {
        String type = FeedProtocol.frameType(frame);
        if (FeedClass.isTickType(type)) {
            broadcaster.broadcast(frame);
        } else if (FeedProtocol.TYPE_CONNECT_ACK.equals(type)) {
            log.debug("[SESSION:{}] Connect ack on stream: {}", userId, frame);
        } else if (frame.has("s") && !"ok".equalsIgnoreCase(frame.path("s").asText())) {
            log.warn("[SESSION:{}] Broker reported not-ok for type={}: {}", userId, type, frame);
        } else {
            log.debug("[SESSION:{}] Other frame type {}: {}", userId, type, frame);
        }
    }

    @Override
    public boolean onReconnectDue() {
        return connectOrReuse();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ═══════════════════════════════════════════════════════════════════════

    private void evict(SymbolIdentity symbol, DownstreamHandle handle) {
        if (index.releaseToken(symbol.wireToken(), handle) == SubscriptionIndex.Release.SYMBOL_RELEASED) {
            log.info("[SESSION:{}] Unsubscribed {} after delivery failure", userId, symbol.formattedSymbol());
            sendSubscription(FeedClass.DETAILED);
            sendSubscription(FeedClass.TOUCHLINE);
        }
    }

    /**
     * Send the complete membership of {@code feedClass}. Best-effort: failures
     * are logged and the index stays as it is.
     */
    private void sendSubscription(FeedClass feedClass) {
        Set<SymbolIdentity> members = index.members(feedClass);
        if (members.isEmpty()) {
            log.debug("[SESSION:{}] No symbols for class {}", userId, feedClass.label());
            return;
        }
        if (!link.isConnected()) {
            log.debug("[SESSION:{}] Not connected, {} subscription deferred", userId, feedClass.label());
            return;
        }

        String frame = FeedProtocol.subscription(feedClass, members);
        try {
            link.send(frame);
            metrics.recordResubscription(feedClass, members.size(), true);
            log.info("[SESSION:{}] Sent {} subscription for {} symbols", userId, feedClass.label(), members.size());
        } catch (IOException e) {
            metrics.recordResubscription(feedClass, members.size(), false);
            log.warn("[SESSION:{}] Failed to send {} subscription: {}", userId, feedClass.label(), e.toString());
        }
    }
}
