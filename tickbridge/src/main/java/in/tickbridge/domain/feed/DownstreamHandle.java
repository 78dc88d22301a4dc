package in.tickbridge.domain.feed;

import java.io.IOException;

/**
 * A viewer connection that receives normalized ticks.
 *
 * Sessions only register and deregister handles; closing the underlying
 * connection belongs to whoever accepted it.
 */
public interface DownstreamHandle {

    /**
     * Stable identifier for logging.
     */
    String id();

    /**
     * Deliver one text message.
     *
     * @throws IOException if the connection can no longer accept messages
     */
    void send(String message) throws IOException;
}
