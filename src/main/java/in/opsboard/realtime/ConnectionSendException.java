package in.opsboard.realtime;

/**
 * Exception thrown when a frame cannot be handed to a connection's transport.
 */
public class ConnectionSendException extends RuntimeException {

    private final String connectionId;

    public ConnectionSendException(String connectionId, String message) {
        super(String.format("[%s] %s", connectionId, message));
        this.connectionId = connectionId;
    }

    public ConnectionSendException(String connectionId, String message, Throwable cause) {
        super(String.format("[%s] %s", connectionId, message), cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
