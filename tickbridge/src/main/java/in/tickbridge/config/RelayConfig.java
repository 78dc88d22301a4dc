package in.tickbridge.config;

import in.tickbridge.infrastructure.broker.common.ReconnectionPolicy;
import in.tickbridge.util.Env;

import java.net.URI;
import java.time.Duration;

/**
 * Relay settings, read once at startup.
 */
public record RelayConfig(
    int port,
    URI feedUrl,
    String restUrl,
    String userId,
    Duration ackTimeout,
    Duration reconnectInitialDelay,
    Duration reconnectMaxDelay,
    int reconnectMaxAttempts,
    Duration reconnectJitter
) {
    public static final String DEFAULT_FEED_URL = "wss://piconnect.flattrade.in/PiConnectWSTp/";
    public static final String DEFAULT_REST_URL = "https://piconnect.flattrade.in/PiConnectTP";

    public static RelayConfig fromEnv() {
        return new RelayConfig(
            Env.getInt("PORT", 8000),
            URI.create(Env.get("FEED_WS_URL", DEFAULT_FEED_URL)),
            Env.get("FEED_REST_URL", DEFAULT_REST_URL),
            Env.get("FEED_USER_ID", "FZ12004"),
            Duration.ofMillis(Env.getLong("FEED_ACK_TIMEOUT_MS", 6_000)),
            Duration.ofMillis(Env.getLong("FEED_RECONNECT_INITIAL_MS", 1_000)),
            Duration.ofMillis(Env.getLong("FEED_RECONNECT_MAX_MS", 60_000)),
            Env.getInt("FEED_RECONNECT_MAX_ATTEMPTS", 10),
            Duration.ofMillis(Env.getLong("FEED_RECONNECT_JITTER_MS", 500))
        );
    }

    /**
     * A fresh policy; each upstream link needs its own.
     */
    public ReconnectionPolicy newReconnectionPolicy() {
        return ReconnectionPolicy.builder()
            .initialDelay(reconnectInitialDelay)
            .maxDelay(reconnectMaxDelay)
            .multiplier(2.0)
            .maxAttempts(reconnectMaxAttempts)
            .maxJitter(reconnectJitter)
            .build();
    }
}
