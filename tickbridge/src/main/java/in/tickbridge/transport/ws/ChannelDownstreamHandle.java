package in.tickbridge.transport.ws;

import in.tickbridge.domain.feed.DownstreamHandle;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.IoUtils;

import java.io.IOException;
import java.util.UUID;

/**
 * Viewer WebSocket as a tick destination.
 *
 * Sends are queued on the channel and never wait for the peer, so a slow viewer
 * cannot hold up the broadcasting thread. A write that fails later closes the
 * channel; the gateway's close listener then drops the subscription, and any
 * send after that fails fast with an {@link IOException}.
 */
public final class ChannelDownstreamHandle implements DownstreamHandle {
    private static final Logger log = LoggerFactory.getLogger(ChannelDownstreamHandle.class);

    private final WebSocketChannel channel;
    private final String id;
    private final WebSocketCallback<Void> onWrite = new WebSocketCallback<>() {
        @Override
        public void complete(WebSocketChannel ch, Void context) {
        }

        @Override
        public void onError(WebSocketChannel ch, Void context, Throwable error) {
            log.warn("[GATEWAY] Send to {} failed, closing: {}", id, error.toString());
            IoUtils.safeClose(ch);
        }
    };

    public ChannelDownstreamHandle(WebSocketChannel channel) {
        this.channel = channel;
        this.id = "ws-" + UUID.randomUUID().toString().substring(0, 8) + "@" + channel.getSourceAddress();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String message) throws IOException {
        if (!channel.isOpen()) {
            throw new IOException("Channel closed: " + id);
        }
        WebSockets.sendText(message, channel, onWrite);
    }

    @Override
    public String toString() {
        return id;
    }
}
