package in.tickbridge.infrastructure.broker.data;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Connector against a small Undertow endpoint that acks handshakes.
 */
class JdkWebSocketConnectorTest {

    private Undertow server;
    private URI endpoint;
    private final JdkWebSocketConnector connector = new JdkWebSocketConnector();

    @BeforeEach
    void setUp() {
        server = Undertow.builder()
            .addHttpListener(0, "localhost")
            .setHandler(Handlers.websocket((exchange, channel) -> {
                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        String text = message.getData();
                        if (text.contains("\"t\":\"c\"")) {
                            WebSockets.sendText("{\"t\":\"ck\",\"s\":\"OK\"}", ch, null);
                        } else if (text.equals("close-me")) {
                            WebSockets.sendClose(1000, "done", ch, null);
                        } else {
                            WebSockets.sendText(text, ch, null);
                        }
                    }
                });
                channel.resumeReceives();
            }))
            .build();
        server.start();

        int port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
        endpoint = URI.create("ws://localhost:" + port + "/");
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void testHandshakeRoundTrip() throws Exception {
        UpstreamConnection conn = connector.open(endpoint);
        try {
            assertTrue(conn.isOpen());
            conn.send("{\"t\":\"c\",\"uid\":\"FZ12004\"}");

            assertEquals("{\"t\":\"ck\",\"s\":\"OK\"}", conn.receive(Duration.ofSeconds(5)));
        } finally {
            conn.close();
        }
    }

    @Test
    void testReceiveTimeoutReturnsNull() throws Exception {
        UpstreamConnection conn = connector.open(endpoint);
        try {
            assertNull(conn.receive(Duration.ofMillis(100)));
        } finally {
            conn.close();
        }
    }

    @Test
    void testFramesArriveInOrder() throws Exception {
        UpstreamConnection conn = connector.open(endpoint);
        try {
            conn.send("{\"n\":1}");
            conn.send("{\"n\":2}");

            assertEquals("{\"n\":1}", conn.receive(Duration.ofSeconds(5)));
            assertEquals("{\"n\":2}", conn.receive(Duration.ofSeconds(5)));
        } finally {
            conn.close();
        }
    }

    @Test
    void testServerCloseIsSeenByEveryRead() throws Exception {
        UpstreamConnection conn = connector.open(endpoint);
        conn.send("close-me");

        assertThrows(ConnectionClosedException.class, conn::receive);
        assertThrows(ConnectionClosedException.class, () -> conn.receive(Duration.ofMillis(50)));
        conn.close();
    }

    @Test
    void testCloseIsIdempotentAndBlocksSends() throws Exception {
        UpstreamConnection conn = connector.open(endpoint);

        conn.close();
        conn.close();

        assertFalse(conn.isOpen());
        assertThrows(ConnectionClosedException.class, () -> conn.send("{}"));
        assertThrows(ConnectionClosedException.class, conn::receive);
    }

    @Test
    void testUnreachableEndpoint() {
        assertThrows(java.io.IOException.class, () -> connector.open(URI.create("ws://localhost:1/")));
    }
}
