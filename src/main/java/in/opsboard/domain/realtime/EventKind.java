package in.opsboard.domain.realtime;

/**
 * Event kinds carried over the realtime wire protocol.
 * Domain kinds are published by business modules; protocol kinds are produced by the session itself.
 */
public enum EventKind {
    // ═══════════════════════════════════════════════════════════════
    // DOMAIN EVENTS (fanned out to a tenant partition)
    // ═══════════════════════════════════════════════════════════════
    ORDER_UPDATE("order_update", false),
    TABLE_UPDATE("table_update", false),
    KDS_UPDATE("kds_update", false),
    INVENTORY_ALERT("inventory_alert", false),
    STAFF_UPDATE("staff_update", false),
    REVENUE_UPDATE("revenue_update", false),

    // ═══════════════════════════════════════════════════════════════
    // PROTOCOL EVENTS (single connection only)
    // ═══════════════════════════════════════════════════════════════
    CONNECTED("connected", true),
    PONG("pong", true),
    HEARTBEAT("heartbeat", true);

    private final String wireName;
    private final boolean protocol;

    EventKind(String wireName, boolean protocol) {
        this.wireName = wireName;
        this.protocol = protocol;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isProtocol() {
        return protocol;
    }

    /**
     * Whether the event materially changes the tenant's metrics snapshot.
     */
    public boolean affectsSnapshot() {
        return switch (this) {
            case ORDER_UPDATE, TABLE_UPDATE, INVENTORY_ALERT, STAFF_UPDATE, REVENUE_UPDATE -> true;
            case KDS_UPDATE, CONNECTED, PONG, HEARTBEAT -> false;
        };
    }

    public static EventKind fromWireName(String name) {
        for (EventKind kind : values()) {
            if (kind.wireName.equals(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown event kind: " + name);
    }
}
