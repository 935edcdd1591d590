package in.opsboard.domain.realtime.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import in.opsboard.domain.realtime.EventKind;

/**
 * Table status change (available, occupied, reserved, cleaning).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableUpdate(
    @JsonProperty("type") String action,
    @JsonProperty("table_id") String tableId,
    @JsonProperty("status") String status,
    @JsonProperty("table") JsonNode table
) implements EventPayload {
    @Override
    @JsonIgnore
    public EventKind kind() {
        return EventKind.TABLE_UPDATE;
    }
}
