package in.tickbridge.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tickbridge.config.RelayConfig;
import in.tickbridge.feedrelay.FeedSession;
import in.tickbridge.feedrelay.SessionFactory;
import in.tickbridge.feedrelay.SessionRegistry;
import in.tickbridge.infrastructure.broker.data.JdkWebSocketConnector;
import in.tickbridge.infrastructure.broker.data.UpstreamConnector;
import in.tickbridge.infrastructure.broker.flattrade.UpstreamLink;
import in.tickbridge.infrastructure.broker.instrument.CachingSymbolResolver;
import in.tickbridge.infrastructure.broker.instrument.FlattradeSymbolResolver;
import in.tickbridge.infrastructure.broker.instrument.SymbolResolver;
import in.tickbridge.infrastructure.broker.metrics.PrometheusMetricsHandler;
import in.tickbridge.infrastructure.broker.metrics.PrometheusRelayMetrics;
import in.tickbridge.transport.ws.MarketFeedGateway;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires the relay:
 * - one FeedSession per FlatTrade session token, created on first viewer
 * - viewer WebSockets at /market/ws/{symbol}
 * - Prometheus metrics at /metrics, liveness at /health
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== TickBridge Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        RelayConfig config = RelayConfig.fromEnv();

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusRelayMetrics metrics = new PrometheusRelayMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Upstream: resolver + session registry
        // ═══════════════════════════════════════════════════════════════
        SymbolResolver resolver = new CachingSymbolResolver(
            new FlattradeSymbolResolver(config.restUrl(), config.userId()));
        UpstreamConnector connector = new JdkWebSocketConnector();
        Clock clock = Clock.systemUTC();

        SessionFactory sessionFactory = (userId, credential) -> new FeedSession(
            userId,
            credential,
            new UpstreamLink(userId, credential, config.feedUrl(), connector, config.ackTimeout(),
                config.newReconnectionPolicy(), metrics),
            resolver,
            clock,
            metrics);
        SessionRegistry registry = new SessionRegistry(sessionFactory, metrics);
        log.info("✓ Session registry ready (feed={}, user={})", config.feedUrl(), config.userId());

        // ═══════════════════════════════════════════════════════════════
        // Transport: HTTP + viewer WebSockets
        // ═══════════════════════════════════════════════════════════════
        MarketFeedGateway gateway = new MarketFeedGateway(registry, config.userId());

        PathHandler paths = Handlers.path()
            .addPrefixPath("/market/ws", gateway.handler())
            .addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .addExactPath("/health", healthHandler(registry));

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(paths)
            .build();
        server.start();
        log.info("✓ HTTP/WS listening on :{}", config.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            gateway.stop();
            registry.closeAll();
            server.stop();
            log.info("Shutdown complete");
        }, "shutdown"));
    }

    private static HttpHandler healthHandler(SessionRegistry registry) {
        return exchange -> {
            ObjectNode body = MAPPER.createObjectNode();
            body.put("status", "UP");
            body.put("sessions", registry.size());
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(body.toString());
        };
    }

    private App() {}
}
