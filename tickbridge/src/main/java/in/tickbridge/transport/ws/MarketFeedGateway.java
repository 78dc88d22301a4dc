package in.tickbridge.transport.ws;

import in.tickbridge.domain.feed.DownstreamHandle;
import in.tickbridge.domain.feed.FeedClass;
import in.tickbridge.feedrelay.FeedSession;
import in.tickbridge.feedrelay.SessionRegistry;
import in.tickbridge.infrastructure.broker.data.FeedAuthenticationException;
import in.tickbridge.security.CredentialValidator;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.Cookie;
import io.undertow.util.AttachmentKey;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Undertow-native viewer endpoint: {@code /market/ws/{symbol}?exchange=NSE&feed_type=t}.
 *
 * - Credential from {@code ?token=} / {@code ?access_token=}, the
 *   {@code Authorization} header, or the {@code token} cookie
 * - Malformed credentials are refused with 401 before the upgrade
 * - After the upgrade: connect the session (close 4003 on failure), subscribe
 *   (close 4004 on failure)
 * - Every successful subscribe is undone exactly once when the channel closes
 */
public final class MarketFeedGateway {
    private static final Logger log = LoggerFactory.getLogger(MarketFeedGateway.class);

    public static final int CLOSE_UPSTREAM_UNAVAILABLE = 4003;
    public static final int CLOSE_SUBSCRIPTION_FAILED = 4004;

    private static final AttachmentKey<FeedRequest> FEED_REQUEST = AttachmentKey.create(FeedRequest.class);

    /**
     * What a viewer asked for.
     */
    public record FeedRequest(String credential, String symbol, String exchange, FeedClass feedClass) {}

    private final SessionRegistry registry;
    private final String userId;
    private final ExecutorService workers;

    public MarketFeedGateway(SessionRegistry registry, String userId) {
        this.registry = registry;
        this.userId = userId;
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "gateway-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Handler to mount under the {@code /market/ws} prefix.
     */
    public HttpHandler handler() {
        WebSocketProtocolHandshakeHandler upgrade = new WebSocketProtocolHandshakeHandler(
            (WebSocketConnectionCallback) this::onConnect);
        return exchange -> {
            FeedRequest request;
            try {
                request = parseRequest(exchange);
            } catch (FeedAuthenticationException e) {
                log.warn("[GATEWAY] Handshake refused from {}: {}", exchange.getSourceAddress(), e.getMessage());
                exchange.setStatusCode(StatusCodes.UNAUTHORIZED);
                exchange.getResponseSender().send(e.getMessage());
                return;
            }
            if (request.symbol().isEmpty()) {
                exchange.setStatusCode(StatusCodes.BAD_REQUEST);
                exchange.getResponseSender().send("Missing symbol");
                return;
            }
            exchange.putAttachment(FEED_REQUEST, request);
            upgrade.handleRequest(exchange);
        };
    }

    public void stop() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[GATEWAY] Workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // REQUEST PARSING
    // ═══════════════════════════════════════════════════════════════════════

    static FeedRequest parseRequest(HttpServerExchange exchange) {
        String credential = CredentialValidator.requireValid(extractCredential(exchange));

        String path = exchange.getRelativePath();
        String symbol = path.startsWith("/") ? path.substring(1) : path;

        String exch = queryParam(exchange, "exchange");
        FeedClass feedClass = FeedClass.fromCode(queryParam(exchange, "feed_type"));
        return new FeedRequest(credential, symbol, exch == null || exch.isBlank() ? "NSE" : exch, feedClass);
    }

    private static String extractCredential(HttpServerExchange exchange) {
        String token = queryParam(exchange, "token");
        if (token == null) {
            token = queryParam(exchange, "access_token");
        }
        if (token != null) {
            return CredentialValidator.stripBearer(token);
        }

        String auth = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (auth != null) {
            return CredentialValidator.stripBearer(auth);
        }

        Cookie cookie = exchange.getRequestCookie("token");
        return cookie != null ? cookie.getValue() : null;
    }

    private static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.peekFirst();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // VIEWER LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    private void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        FeedRequest request = exchange.getAttachment(FEED_REQUEST);
        ChannelDownstreamHandle handle = new ChannelDownstreamHandle(channel);
        ViewerBinding binding = new ViewerBinding(request, handle);

        log.info("[GATEWAY] Viewer {} accepted for {}|{} (token={})", handle.id(), request.exchange(),
            request.symbol(), CredentialValidator.mask(request.credential()));

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                log.debug("[GATEWAY] Message from {}: {}", handle.id(), message.getData());
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                log.warn("[GATEWAY] Viewer {} error: {}", handle.id(), error.toString());
                super.onError(ch, error);
            }
        });
        channel.getCloseSetter().set(c -> {
            log.info("[GATEWAY] Viewer {} disconnected", handle.id());
            // unsubscribe may write upstream; keep it off the I/O thread
            try {
                workers.execute(binding::release);
            } catch (RejectedExecutionException e) {
                binding.release();
            }
        });
        channel.resumeReceives();

        workers.execute(() -> attach(binding, channel));
    }

    private void attach(ViewerBinding binding, WebSocketChannel channel) {
        FeedRequest request = binding.request;
        FeedSession session = registry.findOrCreate(userId, request.credential());

        if (!session.connectOrReuse()) {
            log.error("[GATEWAY] Upstream connect failed (token={})", CredentialValidator.mask(request.credential()));
            close(channel, CLOSE_UPSTREAM_UNAVAILABLE, "Failed to connect to market data provider");
            return;
        }

        try {
            session.subscribe(request.symbol(), binding.handle, request.exchange(), request.feedClass());
        } catch (RuntimeException e) {
            log.warn("[GATEWAY] Subscribe failed for {}|{}: {}", request.exchange(), request.symbol(), e.getMessage());
            close(channel, CLOSE_SUBSCRIPTION_FAILED, "Subscription failed");
            return;
        }

        binding.subscribed(session);
        if (!channel.isOpen()) {
            binding.release();
        }
    }

    private static void close(WebSocketChannel channel, int code, String reason) {
        if (channel.isOpen()) {
            WebSockets.sendClose(code, reason, channel, null);
        }
    }

    /**
     * One viewer's subscription; released at most once.
     */
    private static final class ViewerBinding {
        private final FeedRequest request;
        private final DownstreamHandle handle;
        private final AtomicBoolean subscribed = new AtomicBoolean(false);
        private final AtomicBoolean released = new AtomicBoolean(false);
        private volatile FeedSession session;

        ViewerBinding(FeedRequest request, DownstreamHandle handle) {
            this.request = request;
            this.handle = handle;
        }

        void subscribed(FeedSession s) {
            session = s;
            subscribed.set(true);
        }

        void release() {
            if (!subscribed.get() || !released.compareAndSet(false, true)) {
                return;
            }
            try {
                session.unsubscribe(request.symbol(), handle, request.exchange());
                log.info("[GATEWAY] Cleanup done for {} ({}|{})", handle.id(), request.exchange(), request.symbol());
            } catch (RuntimeException e) {
                log.error("[GATEWAY] Cleanup failed for {} ({}|{})", handle.id(), request.exchange(),
                    request.symbol(), e);
            }
        }
    }
}
