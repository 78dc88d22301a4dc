package in.tickbridge.infrastructure.broker.data;

import java.io.IOException;
import java.time.Duration;

/**
 * One open streaming connection to the broker feed.
 *
 * Exactly one reader is expected. Sends may come from any thread.
 */
public interface UpstreamConnection {

    /**
     * Send one complete text frame.
     *
     * @throws ConnectionClosedException if the connection is closed
     * @throws IOException on any other transport failure
     */
    void send(String text) throws IOException;

    /**
     * Wait up to {@code timeout} for the next text frame.
     *
     * @return the frame, or {@code null} if none arrived in time
     * @throws ConnectionClosedException if the connection closed before a frame arrived
     */
    String receive(Duration timeout) throws IOException, InterruptedException;

    /**
     * Block until the next text frame.
     *
     * @throws ConnectionClosedException once the connection is closed
     */
    String receive() throws IOException, InterruptedException;

    boolean isOpen();

    /**
     * Close the connection. Safe to call more than once.
     */
    void close();
}
