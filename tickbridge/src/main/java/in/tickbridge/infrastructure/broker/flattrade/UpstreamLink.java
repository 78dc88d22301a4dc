package in.tickbridge.infrastructure.broker.flattrade;

import com.fasterxml.jackson.databind.JsonNode;
import in.tickbridge.infrastructure.broker.common.ReconnectionPolicy;
import in.tickbridge.infrastructure.broker.data.ConnectionClosedException;
import in.tickbridge.infrastructure.broker.data.UpstreamConnection;
import in.tickbridge.infrastructure.broker.data.UpstreamConnector;
import in.tickbridge.infrastructure.broker.metrics.RelayMetrics;
import in.tickbridge.security.CredentialValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single streaming connection to the FlatTrade feed for one credential.
 *
 * Owns the connection handle, the receive-loop thread and the reconnect state.
 * Connection state machine:
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED -> (loop failure) BACKOFF -> CONNECTING
 * </pre>
 * Callers must serialize {@link #connect()}; {@code FeedSession} does so with its
 * connect gate.
 */
public final class UpstreamLink {
    private static final Logger log = LoggerFactory.getLogger(UpstreamLink.class);

    public static final String BROKER_CODE = "FLATTRADE";
    public static final Duration DEFAULT_ACK_TIMEOUT = Duration.ofSeconds(6);
    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(5);

    public enum LinkState {
        DISCONNECTED,
        CONNECTING,
        CONNECTED,
        BACKOFF
    }

    /**
     * Receives what the link reads and decides how a reconnect is carried out.
     */
    public interface Listener {

        /**
         * Called on the receive thread for every JSON frame after the handshake.
         */
        void onFrame(JsonNode frame);

        /**
         * Called on the reconnect thread when a backoff delay has elapsed.
         *
         * @return true if the link is connected again
         */
        boolean onReconnectDue();
    }

    private final String userId;
    private final String credential;
    private final URI endpoint;
    private final UpstreamConnector connector;
    private final Duration ackTimeout;
    private final ReconnectionPolicy reconnectionPolicy;
    private final RelayMetrics metrics;

    private final AtomicReference<UpstreamConnection> connectionRef = new AtomicReference<>(null);
    private final ScheduledExecutorService reconnectScheduler;

    private volatile Listener listener;
    private volatile Thread receiveThread;
    private volatile ScheduledFuture<?> pendingReconnect;
    private volatile LinkState state = LinkState.DISCONNECTED;
    private volatile boolean stopped = false;

    public UpstreamLink(String userId, String credential, URI endpoint, UpstreamConnector connector,
                        Duration ackTimeout, ReconnectionPolicy reconnectionPolicy, RelayMetrics metrics) {
        this.userId = userId;
        this.credential = credential;
        this.endpoint = endpoint;
        this.connector = connector;
        this.ackTimeout = ackTimeout;
        this.reconnectionPolicy = reconnectionPolicy;
        this.metrics = metrics;
        this.reconnectScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "feed-reconnect-" + userId);
            t.setDaemon(true);
            return t;
        });
    }

    public void setListener(Listener listener) {
        this.listener = listener;
    }

    /**
     * Open the connection and perform the handshake.
     * Never throws; a false result means no connection is held.
     *
     * @return true if connected (already, or after a positive ack)
     */
    public boolean connect() {
        if (isConnected()) {
            return true;
        }

        stopped = false;
        state = LinkState.CONNECTING;

        // the previous handle goes before a new one is opened
        closeCurrent();
        awaitReceiveLoop();

        log.info("[FEED:{}] Connecting to {} (token={})", userId, endpoint, CredentialValidator.mask(credential));

        UpstreamConnection conn = null;
        HandshakeOutcome outcome;
        try {
            conn = connector.open(endpoint);
            conn.send(FeedProtocol.handshake(userId, credential));

            String raw = conn.receive(ackTimeout);
            if (raw == null) {
                outcome = HandshakeOutcome.TIMEOUT;
                log.error("[FEED:{}] Timeout waiting for connect ack ({}ms)", userId, ackTimeout.toMillis());
            } else {
                outcome = FeedProtocol.evaluateAck(raw);
                if (outcome == HandshakeOutcome.REJECTED) {
                    log.error("[FEED:{}] Connect ack not OK: {}", userId, raw);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = HandshakeOutcome.TRANSPORT_ERROR;
            log.warn("[FEED:{}] Interrupted during handshake", userId);
        } catch (IOException | RuntimeException e) {
            outcome = HandshakeOutcome.TRANSPORT_ERROR;
            log.error("[FEED:{}] Handshake failed: {}", userId, e.toString());
        }

        metrics.recordHandshake(outcome.name());

        if (outcome != HandshakeOutcome.ACCEPTED || stopped) {
            if (conn != null) {
                conn.close();
            }
            state = LinkState.DISCONNECTED;
            return false;
        }

        connectionRef.set(conn);
        reconnectionPolicy.recordSuccess();
        state = LinkState.CONNECTED;
        log.info("[FEED:{}] Connect ack OK", userId);

        startReceiveLoop(conn);
        return true;
    }

    /**
     * Send one frame on the live connection.
     *
     * @throws ConnectionClosedException if there is no live connection
     */
    public void send(String frame) throws IOException {
        UpstreamConnection conn = connectionRef.get();
        if (conn == null || state != LinkState.CONNECTED) {
            throw new ConnectionClosedException("Not connected to feed");
        }
        conn.send(frame);
    }

    public boolean isConnected() {
        UpstreamConnection conn = connectionRef.get();
        return state == LinkState.CONNECTED && conn != null && conn.isOpen();
    }

    /**
     * Stop the link: cancel any pending reconnect, close the connection and wait
     * for the receive loop to finish. A later {@link #connect()} is allowed.
     */
    public void close() {
        stopped = true;

        ScheduledFuture<?> pending = pendingReconnect;
        if (pending != null) {
            pending.cancel(false);
            pendingReconnect = null;
        }

        closeCurrent();
        state = LinkState.DISCONNECTED;
        awaitReceiveLoop();
        log.info("[FEED:{}] Link closed", userId);
    }

    /**
     * Close and release the reconnect thread. The link cannot reconnect afterwards.
     */
    public void shutdown() {
        close();
        reconnectScheduler.shutdownNow();
    }

    public LinkState getState() {
        return state;
    }

    public boolean isStopped() {
        return stopped;
    }

    Optional<Thread> receiveThread() {
        return Optional.ofNullable(receiveThread);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // RECEIVE LOOP
    // ═══════════════════════════════════════════════════════════════════════

    private void startReceiveLoop(UpstreamConnection conn) {
        Thread t = new Thread(() -> receiveLoop(conn), "feed-rx-" + userId);
        t.setDaemon(true);
        receiveThread = t;
        t.start();
    }

    private void receiveLoop(UpstreamConnection conn) {
        log.info("[FEED:{}] Receive loop started", userId);
        try {
            while (!stopped) {
                String raw = conn.receive();
                Optional<JsonNode> frame = FeedProtocol.parse(raw);
                if (frame.isEmpty()) {
                    log.debug("[FEED:{}] Non-JSON frame skipped: {}", userId, raw);
                    continue;
                }
                dispatch(frame.get());
            }
        } catch (ConnectionClosedException e) {
            if (!stopped) {
                log.warn("[FEED:{}] Connection closed unexpectedly", userId);
            }
        } catch (IOException e) {
            log.warn("[FEED:{}] Receive failed: {}", userId, e.toString());
        } catch (RuntimeException e) {
            log.error("[FEED:{}] Receive loop failed", userId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            onLoopExit(conn);
        }
    }

    private void dispatch(JsonNode frame) {
        Listener l = listener;
        if (l == null) {
            return;
        }
        try {
            l.onFrame(frame);
        } catch (RuntimeException e) {
            log.error("[FEED:{}] Frame handler failed for type={}", userId, FeedProtocol.frameType(frame), e);
        }
    }

    private void onLoopExit(UpstreamConnection conn) {
        // Only the current handle counts as lost; a replaced one was closed on purpose.
        boolean lost = connectionRef.compareAndSet(conn, null);
        conn.close();
        if (lost) {
            state = LinkState.DISCONNECTED;
        }
        log.info("[FEED:{}] Receive loop ended", userId);

        if (lost && !stopped) {
            scheduleReconnect();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // RECONNECT
    // ═══════════════════════════════════════════════════════════════════════

    private synchronized void scheduleReconnect() {
        if (stopped || reconnectScheduler.isShutdown()) {
            return;
        }
        if (!reconnectionPolicy.shouldRetry()) {
            log.error("[FEED:{}] Reconnect budget exhausted after {} attempts; staying disconnected",
                userId, reconnectionPolicy.getAttemptCount());
            state = LinkState.DISCONNECTED;
            return;
        }

        Duration delay = reconnectionPolicy.nextDelay();
        reconnectionPolicy.recordFailure();
        int attempt = reconnectionPolicy.getAttemptCount();

        state = LinkState.BACKOFF;
        metrics.recordReconnectScheduled(attempt);
        log.warn("[FEED:{}] Reconnect #{} in {}ms", userId, attempt, delay.toMillis());

        pendingReconnect = reconnectScheduler.schedule(this::runReconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runReconnect() {
        if (stopped) {
            return;
        }
        Listener l = listener;
        boolean ok;
        try {
            ok = l != null ? l.onReconnectDue() : connect();
        } catch (RuntimeException e) {
            log.error("[FEED:{}] Reconnect attempt failed", userId, e);
            ok = false;
        }
        if (!ok && !stopped) {
            scheduleReconnect();
        }
    }

    private void closeCurrent() {
        UpstreamConnection prior = connectionRef.getAndSet(null);
        if (prior != null) {
            prior.close();
        }
    }

    private void awaitReceiveLoop() {
        Thread t = receiveThread;
        if (t == null || t == Thread.currentThread()) {
            return;
        }
        try {
            t.join(JOIN_TIMEOUT.toMillis());
            if (t.isAlive()) {
                log.warn("[FEED:{}] Receive loop did not finish within {}s", userId, JOIN_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
