package in.opsboard.domain.realtime.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import in.opsboard.domain.realtime.EventKind;

/**
 * New order or order status change.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderUpdate(
    @JsonProperty("type") String action,        // new_order | status_change | payment | cancelled
    @JsonProperty("order_id") String orderId,
    @JsonProperty("status") String status,
    @JsonProperty("order") JsonNode order
) implements EventPayload {
    @Override
    @JsonIgnore
    public EventKind kind() {
        return EventKind.ORDER_UPDATE;
    }
}
