package in.tickbridge.infrastructure.broker.flattrade;

import com.fasterxml.jackson.databind.JsonNode;
import in.tickbridge.infrastructure.broker.common.ReconnectionPolicy;
import in.tickbridge.infrastructure.broker.data.ConnectionClosedException;
import in.tickbridge.infrastructure.broker.data.FakeUpstreamConnector;
import in.tickbridge.infrastructure.broker.metrics.RelayMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Link lifecycle against an in-memory feed.
 *
 * Tests:
 * - Handshake outcomes
 * - Frame dispatch from the receive loop
 * - Reconnect after connection loss, and the attempt budget
 * - Close semantics
 */
class UpstreamLinkTest {

    private static final String CREDENTIAL = "0123456789abcdef0123456789abcdef";

    private FakeUpstreamConnector connector;
    private ReconnectionPolicy policy;
    private UpstreamLink link;
    private final List<JsonNode> frames = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        connector = new FakeUpstreamConnector();
        policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(20))
            .maxDelay(Duration.ofMillis(100))
            .maxAttempts(3)
            .build();
        link = new UpstreamLink("FZ12004", CREDENTIAL, URI.create("ws://feed.test/"), connector,
            Duration.ofMillis(200), policy, RelayMetrics.NOOP);
    }

    @AfterEach
    void tearDown() {
        link.shutdown();
    }

    @Test
    void testConnectAccepted() {
        assertTrue(link.connect());

        assertTrue(link.isConnected());
        assertEquals(UpstreamLink.LinkState.CONNECTED, link.getState());
        assertEquals(1, connector.opened().size());
        assertTrue(connector.last().sent().get(0).contains("\"t\":\"c\""), "Handshake is the first frame");
        assertTrue(link.receiveThread().isPresent());
    }

    @Test
    void testConnectWhenConnectedReusesConnection() {
        assertTrue(link.connect());
        assertTrue(link.connect());

        assertEquals(1, connector.opened().size());
    }

    @Test
    void testRejectedAckClosesConnection() {
        connector.replyWith("{\"t\":\"ck\",\"s\":\"NOT_OK\"}");

        assertFalse(link.connect());

        assertFalse(link.isConnected());
        assertFalse(connector.last().isOpen(), "Rejected handle is closed");
        assertEquals(UpstreamLink.LinkState.DISCONNECTED, link.getState());
    }

    @Test
    void testAckTimeout() {
        connector.replyWith(null);

        assertFalse(link.connect());

        assertFalse(connector.last().isOpen());
        assertFalse(link.isConnected());
    }

    @Test
    void testTransportFailure() {
        connector.failOpens(new IOException("connection refused"));

        assertFalse(link.connect());
        assertEquals(UpstreamLink.LinkState.DISCONNECTED, link.getState());
    }

    @Test
    void testSendRequiresConnection() {
        assertThrows(ConnectionClosedException.class, () -> link.send("{\"t\":\"t\",\"k\":\"NSE|22\"}"));
    }

    @Test
    void testFramesDispatchedAndGarbageSkipped() throws Exception {
        link.setListener(new RecordingListener());
        assertTrue(link.connect());

        connector.last().push("not json");
        connector.last().push("{\"t\":\"tf\",\"tk\":\"22\",\"lp\":\"1\"}");

        await(() -> frames.size() == 1);
        assertEquals("22", frames.get(0).get("tk").asText());
        assertTrue(link.isConnected(), "Garbage does not end the loop");
    }

    @Test
    void testListenerFailureDoesNotEndLoop() throws Exception {
        link.setListener(new RecordingListener() {
            @Override
            public void onFrame(JsonNode frame) {
                if ("boom".equals(frame.path("t").asText())) {
                    throw new IllegalStateException("handler bug");
                }
                super.onFrame(frame);
            }
        });
        assertTrue(link.connect());

        connector.last().push("{\"t\":\"boom\"}");
        connector.last().push("{\"t\":\"tf\",\"tk\":\"22\"}");

        await(() -> frames.size() == 1);
        assertTrue(link.isConnected());
    }

    @Test
    void testReconnectAfterConnectionLoss() throws Exception {
        assertTrue(link.connect());
        FakeUpstreamConnector.FakeConnection first = connector.last();

        first.drop();

        await(() -> connector.opened().size() == 2 && link.isConnected());
        assertFalse(first.isOpen());
        assertEquals(0, policy.getAttemptCount(), "Successful reconnect resets the policy");
    }

    @Test
    void testUnexpectedReceiveFailureEndsLoopAndReconnects() throws Exception {
        assertTrue(link.connect());
        FakeUpstreamConnector.FakeConnection first = connector.last();
        Thread rx = link.receiveThread().orElseThrow();

        first.failReceive(new IllegalStateException("decoder state corrupted"));

        await(() -> connector.opened().size() == 2 && link.isConnected());
        assertFalse(first.isOpen(), "Failed connection is closed");
        rx.join(1_000);
        assertFalse(rx.isAlive());
    }

    @Test
    void testReconnectBudgetExhausted() throws Exception {
        assertTrue(link.connect());
        connector.failOpens(new IOException("connection refused"));

        connector.last().drop();

        await(policy::isCircuitOpen);
        await(() -> link.getState() == UpstreamLink.LinkState.DISCONNECTED);
        Thread.sleep(300);
        assertEquals(UpstreamLink.LinkState.DISCONNECTED, link.getState(), "No attempts once the circuit is open");
        assertFalse(link.isConnected());
    }

    @Test
    void testCloseJoinsReceiveLoopWithoutReconnect() throws Exception {
        assertTrue(link.connect());
        Thread rx = link.receiveThread().orElseThrow();

        link.close();

        assertFalse(rx.isAlive(), "Receive loop joined on close");
        assertTrue(link.isStopped());
        assertEquals(UpstreamLink.LinkState.DISCONNECTED, link.getState());
        Thread.sleep(100);
        assertEquals(1, connector.opened().size(), "Close never schedules a reconnect");
    }

    @Test
    void testConnectAfterCloseIsAllowed() {
        assertTrue(link.connect());
        link.close();

        assertTrue(link.connect());
        assertFalse(link.isStopped());
        assertEquals(2, connector.opened().size());
    }

    private class RecordingListener implements UpstreamLink.Listener {
        @Override
        public void onFrame(JsonNode frame) {
            frames.add(frame);
        }

        @Override
        public boolean onReconnectDue() {
            return link.connect();
        }
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
