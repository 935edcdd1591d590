package in.opsboard.realtime;

/**
 * Exception thrown when a tenant's metrics snapshot cannot be computed.
 */
public class AggregationException extends RuntimeException {

    private final String tenantId;

    public AggregationException(String tenantId, String message) {
        super(String.format("[%s] %s", tenantId, message));
        this.tenantId = tenantId;
    }

    public AggregationException(String tenantId, String message, Throwable cause) {
        super(String.format("[%s] %s", tenantId, message), cause);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
