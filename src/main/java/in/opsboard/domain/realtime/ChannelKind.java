package in.opsboard.domain.realtime;

/**
 * Functional connection category. Every live connection belongs to exactly one channel.
 */
public enum ChannelKind {
    DASHBOARD("dashboard"),
    KITCHEN_DISPLAY("kitchen-display"),
    TABLE_VIEW("table-view");

    private final String wireName;

    ChannelKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
