package in.opsboard.realtime;

/**
 * Lifecycle of a {@link ConnectionSession}.
 */
public enum SessionState {
    CONNECTING,     // handshake accepted, not yet registered
    CONNECTED,      // registered, initial snapshot being sent
    IDLE,           // waiting for a client frame or the idle timeout
    PROCESSING,     // handling a client frame
    CLOSED
}
