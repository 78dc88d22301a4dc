package in.tickbridge.feedrelay;

import com.fasterxml.jackson.databind.JsonNode;
import in.tickbridge.domain.feed.DownstreamHandle;
import in.tickbridge.domain.feed.FeedClass;
import in.tickbridge.domain.feed.SymbolIdentity;
import in.tickbridge.infrastructure.broker.flattrade.FeedProtocol;
import in.tickbridge.infrastructure.broker.metrics.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Fans one inbound tick out to every handle subscribed to its token.
 *
 * Delivery iterates a snapshot. A handle that fails to receive is evicted after
 * the pass through {@code evictor}, which goes through the normal unsubscribe path.
 */
public final class TickBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(TickBroadcaster.class);

    private final SubscriptionIndex index;
    private final BiConsumer<SymbolIdentity, DownstreamHandle> evictor;
    private final Clock clock;
    private final RelayMetrics metrics;

    public TickBroadcaster(SubscriptionIndex index, BiConsumer<SymbolIdentity, DownstreamHandle> evictor,
                           Clock clock, RelayMetrics metrics) {
        this.index = index;
        this.evictor = evictor;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * @return number of handles the tick was delivered to
     */
    public int broadcast(JsonNode frame) {
        String token = FeedProtocol.token(frame);

        List<DownstreamHandle> handles = index.handlesFor(token);
        Optional<SymbolIdentity> symbol = index.symbolFor(token);
        if (handles.isEmpty() || symbol.isEmpty()) {
            log.trace("[RELAY] No clients for token {}", token);
            metrics.recordTickDropped();
            return 0;
        }

        String json = TickJsonMapper.toJson(frame, symbol.get(), clock.instant().getEpochSecond());

        int delivered = 0;
        List<DownstreamHandle> failed = new ArrayList<>();
        for (DownstreamHandle handle : handles) {
            try {
                handle.send(json);
                delivered++;
            } catch (Exception e) {
                log.debug("[RELAY] Send to {} failed, evicting: {}", handle.id(), e.toString());
                metrics.recordDeliveryFailure();
                failed.add(handle);
            }
        }

        for (DownstreamHandle dead : failed) {
            evictor.accept(symbol.get(), dead);
        }

        metrics.recordTickDelivered(FeedClass.fromTickType(FeedProtocol.frameType(frame)), delivered);
        return delivered;
    }
}
