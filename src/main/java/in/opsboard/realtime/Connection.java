package in.opsboard.realtime;

import in.opsboard.domain.realtime.ChannelKind;

/**
 * Live bidirectional channel to one client.
 *
 * Implementations must serialize concurrent {@link #send(String)} calls: the broadcast path and the
 * owning session's pong/heartbeat writes arrive from different threads.
 */
public interface Connection {

    /**
     * Process-unique identifier.
     */
    String id();

    String tenantId();

    ChannelKind channel();

    /**
     * Station (kitchen display) or location (table view); null when unqualified.
     */
    String subKey();

    /**
     * Send one text frame.
     *
     * @throws ConnectionSendException if the peer is gone or the outbound buffer is full
     */
    void send(String frame);

    boolean isOpen();

    /**
     * Close the underlying transport. Safe to call more than once.
     */
    void close();
}
