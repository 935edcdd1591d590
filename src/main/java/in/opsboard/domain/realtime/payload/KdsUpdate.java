package in.opsboard.domain.realtime.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import in.opsboard.domain.realtime.EventKind;

/**
 * Kitchen ticket created or moved between statuses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KdsUpdate(
    @JsonProperty("type") String action,        // new_order | status_update | bumped
    @JsonProperty("order_id") String orderId,
    @JsonProperty("station") String station,    // grill, fryer, ... null when not station-bound
    @JsonProperty("status") String status,
    @JsonProperty("order") JsonNode order
) implements EventPayload {
    @Override
    @JsonIgnore
    public EventKind kind() {
        return EventKind.KDS_UPDATE;
    }
}
