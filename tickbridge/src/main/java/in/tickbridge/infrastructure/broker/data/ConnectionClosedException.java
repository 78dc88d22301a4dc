package in.tickbridge.infrastructure.broker.data;

import java.io.IOException;

/**
 * Signals that the upstream connection is closed and no further frames will arrive.
 */
public class ConnectionClosedException extends IOException {

    public ConnectionClosedException(String message) {
        super(message);
    }

    public ConnectionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
