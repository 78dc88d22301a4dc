package in.tickbridge.infrastructure.broker.data;

import java.io.IOException;
import java.net.URI;

/**
 * Opens streaming connections to the broker feed.
 */
@FunctionalInterface
public interface UpstreamConnector {

    UpstreamConnection open(URI endpoint) throws IOException, InterruptedException;
}
