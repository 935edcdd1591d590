package in.opsboard.domain.realtime.payload;

import in.opsboard.domain.realtime.EventKind;

/**
 * Typed body of a domain event. Each implementation is bound to exactly one {@link EventKind}.
 */
public interface EventPayload {
    EventKind kind();
}
