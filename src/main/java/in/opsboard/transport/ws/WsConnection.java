package in.opsboard.transport.ws;

import in.opsboard.domain.realtime.ChannelKind;
import in.opsboard.realtime.Connection;
import in.opsboard.realtime.ConnectionSendException;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Connection} over an Undertow {@link WebSocketChannel}.
 *
 * Sends are serialized on this object so frames reach the channel in call order. At most
 * {@code maxPendingFrames} frames may be in flight; beyond that the peer is considered stuck and the
 * send fails.
 */
public final class WsConnection implements Connection {
    private static final Logger log = LoggerFactory.getLogger(WsConnection.class);

    private final String id = UUID.randomUUID().toString();
    private final WebSocketChannel channel;
    private final String tenantId;
    private final ChannelKind channelKind;
    private final String subKey;
    private final int maxPendingFrames;
    private final FrameWriter writer;

    private final AtomicInteger pendingFrames = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final WebSocketCallback<Void> sendCallback = new WebSocketCallback<>() {
        @Override
        public void complete(WebSocketChannel ch, Void context) {
            pendingFrames.decrementAndGet();
        }

        @Override
        public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
            pendingFrames.decrementAndGet();
            log.warn("[WS] async send to {} failed: {}", id, throwable.toString());
            close();
        }
    };

    public WsConnection(WebSocketChannel channel, String tenantId, ChannelKind channelKind, String subKey,
                        int maxPendingFrames) {
        this(channel, tenantId, channelKind, subKey, maxPendingFrames, WebSockets::sendText);
    }

    WsConnection(WebSocketChannel channel, String tenantId, ChannelKind channelKind, String subKey,
                 int maxPendingFrames, FrameWriter writer) {
        if (maxPendingFrames <= 0) {
            throw new IllegalArgumentException("maxPendingFrames must be positive: " + maxPendingFrames);
        }
        this.channel = channel;
        this.tenantId = tenantId;
        this.channelKind = channelKind;
        this.subKey = subKey;
        this.maxPendingFrames = maxPendingFrames;
        this.writer = writer;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String tenantId() {
        return tenantId;
    }

    @Override
    public ChannelKind channel() {
        return channelKind;
    }

    @Override
    public String subKey() {
        return subKey;
    }

    @Override
    public void send(String frame) {
        synchronized (this) {
            if (closed.get() || !channel.isOpen()) {
                throw new ConnectionSendException(id, "channel closed");
            }
            if (pendingFrames.get() >= maxPendingFrames) {
                throw new ConnectionSendException(id, "send buffer full (" + maxPendingFrames + " frames pending)");
            }
            pendingFrames.incrementAndGet();
            try {
                writer.write(frame, channel, sendCallback);
            } catch (RuntimeException e) {
                pendingFrames.decrementAndGet();
                throw new ConnectionSendException(id, "send failed", e);
            }
        }
    }

    int pendingFrames() {
        return pendingFrames.get();
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isOpen();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[WS] close of {} failed: {}", id, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WsConnection{" + id + ", " + tenantId + "/" + channelKind.wireName()
            + (subKey == null ? "" : "/" + subKey) + ", peer=" + channel.getSourceAddress() + "}";
    }

    /**
     * Hands one text frame to the channel; the callback fires once the frame is flushed or fails.
     */
    @FunctionalInterface
    interface FrameWriter {
        void write(String frame, WebSocketChannel channel, WebSocketCallback<Void> callback);
    }
}
