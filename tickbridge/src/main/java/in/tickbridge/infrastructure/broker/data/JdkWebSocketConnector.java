package in.tickbridge.infrastructure.broker.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Upstream connector on top of the JDK {@link java.net.http.WebSocket} client.
 *
 * The listener assembles fragmented text messages and hands complete frames to
 * a queue, so callers can read one frame at a time with or without a timeout.
 */
public final class JdkWebSocketConnector implements UpstreamConnector {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketConnector.class);

    private static final Duration OPEN_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;

    public JdkWebSocketConnector() {
        this(HttpClient.newBuilder()
            .connectTimeout(OPEN_TIMEOUT)
            .build());
    }

    public JdkWebSocketConnector(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public UpstreamConnection open(URI endpoint) throws IOException, InterruptedException {
        QueueingListener listener = new QueueingListener();
        try {
            WebSocket ws = httpClient.newWebSocketBuilder()
                .connectTimeout(OPEN_TIMEOUT)
                .buildAsync(endpoint, listener)
                .get(OPEN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            return new JdkWebSocketConnection(ws, listener.inbound);
        } catch (ExecutionException e) {
            throw new IOException("WebSocket open failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("WebSocket open timed out after " + OPEN_TIMEOUT.toSeconds() + "s", e);
        }
    }

    /**
     * Marker placed on the queue once the socket is gone. It is never consumed,
     * so every later read also observes the closure.
     */
    private static final Object CLOSED = new Object();

    private static final class QueueingListener implements WebSocket.Listener {
        private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
        private final StringBuilder buf = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                inbound.add(buf.toString());
                buf.setLength(0);
            }
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.warn("[FEED] Upstream closed: {} {}", statusCode, reason);
            inbound.add(CLOSED);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.error("[FEED] Upstream WebSocket error: {}", error.toString());
            inbound.add(CLOSED);
        }
    }

    private static final class JdkWebSocketConnection implements UpstreamConnection {
        private final WebSocket ws;
        private final BlockingQueue<Object> inbound;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        JdkWebSocketConnection(WebSocket ws, BlockingQueue<Object> inbound) {
            this.ws = ws;
            this.inbound = inbound;
        }

        // The JDK client rejects a send while another is outstanding.
        @Override
        public synchronized void send(String text) throws IOException {
            if (!isOpen()) {
                throw new ConnectionClosedException("Upstream connection is closed");
            }
            try {
                ws.sendText(text, true).get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while sending", e);
            } catch (ExecutionException e) {
                throw new IOException("Send failed: " + e.getCause().getMessage(), e.getCause());
            } catch (TimeoutException e) {
                throw new IOException("Send timed out", e);
            }
        }

        @Override
        public String receive(Duration timeout) throws IOException, InterruptedException {
            Object next = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return unwrap(next);
        }

        @Override
        public String receive() throws IOException, InterruptedException {
            return unwrap(inbound.take());
        }

        private String unwrap(Object next) throws ConnectionClosedException {
            if (next == CLOSED) {
                inbound.add(CLOSED);
                throw new ConnectionClosedException("Upstream connection closed");
            }
            return (String) next;
        }

        @Override
        public boolean isOpen() {
            return !closed.get() && !ws.isInputClosed() && !ws.isOutputClosed();
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                if (!ws.isOutputClosed()) {
                    ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye")
                        .get(2, TimeUnit.SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                log.debug("[FEED] Close handshake not completed: {}", e.toString());
            } finally {
                ws.abort();
                inbound.add(CLOSED);
            }
        }
    }
}
