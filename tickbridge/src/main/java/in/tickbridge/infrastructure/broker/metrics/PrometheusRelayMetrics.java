package in.tickbridge.infrastructure.broker.metrics;

import in.tickbridge.domain.feed.FeedClass;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus implementation of {@link RelayMetrics}.
 *
 * Key Metrics:
 * - relay_handshakes_total{outcome}
 * - relay_resubscriptions_total{feed_class, status}
 * - relay_resubscription_symbols{feed_class}
 * - relay_ticks_delivered_total{feed_class}
 * - relay_tick_deliveries_total{feed_class}
 * - relay_ticks_dropped_total
 * - relay_delivery_failures_total
 * - relay_reconnects_total
 * - relay_active_sessions
 */
public class PrometheusRelayMetrics implements RelayMetrics {

    private final CollectorRegistry registry;

    private final Counter handshakeCounter;
    private final Counter resubscriptionCounter;
    private final Gauge resubscriptionSymbols;
    private final Counter ticksDelivered;
    private final Counter tickDeliveries;
    private final Counter ticksDropped;
    private final Counter deliveryFailures;
    private final Counter reconnects;
    private final Gauge activeSessions;

    public PrometheusRelayMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusRelayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.handshakeCounter = Counter.build()
            .name("relay_handshakes_total")
            .help("Upstream handshakes by outcome")
            .labelNames("outcome")
            .register(registry);

        this.resubscriptionCounter = Counter.build()
            .name("relay_resubscriptions_total")
            .help("Batched re-subscription frames sent upstream")
            .labelNames("feed_class", "status")
            .register(registry);

        this.resubscriptionSymbols = Gauge.build()
            .name("relay_resubscription_symbols")
            .help("Instruments carried by the last re-subscription frame")
            .labelNames("feed_class")
            .register(registry);

        this.ticksDelivered = Counter.build()
            .name("relay_ticks_delivered_total")
            .help("Inbound ticks fanned out to at least one viewer")
            .labelNames("feed_class")
            .register(registry);

        this.tickDeliveries = Counter.build()
            .name("relay_tick_deliveries_total")
            .help("Individual tick messages sent to viewers")
            .labelNames("feed_class")
            .register(registry);

        this.ticksDropped = Counter.build()
            .name("relay_ticks_dropped_total")
            .help("Inbound ticks with no subscribed viewer")
            .register(registry);

        this.deliveryFailures = Counter.build()
            .name("relay_delivery_failures_total")
            .help("Failed sends to a viewer connection")
            .register(registry);

        this.reconnects = Counter.build()
            .name("relay_reconnects_total")
            .help("Scheduled upstream reconnect attempts")
            .register(registry);

        this.activeSessions = Gauge.build()
            .name("relay_active_sessions")
            .help("Sessions held by the registry")
            .register(registry);
    }

    @Override
    public void recordHandshake(String outcome) {
        handshakeCounter.labels(outcome).inc();
    }

    @Override
    public void recordResubscription(FeedClass feedClass, int symbolCount, boolean success) {
        String cls = feedClass.label();
        resubscriptionCounter.labels(cls, success ? "success" : "failure").inc();
        if (success) {
            resubscriptionSymbols.labels(cls).set(symbolCount);
        }
    }

    @Override
    public void recordTickDelivered(FeedClass feedClass, int handles) {
        ticksDelivered.labels(feedClass.label()).inc();
        tickDeliveries.labels(feedClass.label()).inc(handles);
    }

    @Override
    public void recordTickDropped() {
        ticksDropped.inc();
    }

    @Override
    public void recordDeliveryFailure() {
        deliveryFailures.inc();
    }

    @Override
    public void recordReconnectScheduled(int attemptNumber) {
        reconnects.inc();
    }

    @Override
    public void setActiveSessions(int count) {
        activeSessions.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
