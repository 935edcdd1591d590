package in.opsboard.domain.realtime.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import in.opsboard.domain.realtime.EventKind;

/**
 * Staff clock in/out or break transition.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StaffUpdate(
    @JsonProperty("type") String action,        // clock_in | clock_out | break_start | break_end
    @JsonProperty("staff_id") String staffId,
    @JsonProperty("staff") JsonNode staff
) implements EventPayload {
    @Override
    @JsonIgnore
    public EventKind kind() {
        return EventKind.STAFF_UPDATE;
    }
}
