package in.opsboard.domain.realtime.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.opsboard.domain.realtime.EventKind;

import java.math.BigDecimal;

/**
 * Running revenue totals after a payment.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RevenueUpdate(
    @JsonProperty("today") BigDecimal today,
    @JsonProperty("this_hour") BigDecimal thisHour,
    @JsonProperty("order_id") String orderId
) implements EventPayload {
    @Override
    @JsonIgnore
    public EventKind kind() {
        return EventKind.REVENUE_UPDATE;
    }
}
