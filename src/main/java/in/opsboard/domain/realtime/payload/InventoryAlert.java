package in.opsboard.domain.realtime.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.opsboard.domain.realtime.EventKind;

import java.math.BigDecimal;

/**
 * Stock for an item dropped to or below its reorder point.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InventoryAlert(
    @JsonProperty("item_id") String itemId,
    @JsonProperty("item_name") String itemName,
    @JsonProperty("current_stock") BigDecimal currentStock,
    @JsonProperty("reorder_point") BigDecimal reorderPoint,
    @JsonProperty("severity") String severity    // low | out_of_stock
) implements EventPayload {
    @Override
    @JsonIgnore
    public EventKind kind() {
        return EventKind.INVENTORY_ALERT;
    }
}
