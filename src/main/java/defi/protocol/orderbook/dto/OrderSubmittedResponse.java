package defi.protocol.orderbook.dto;

import defi.protocol.orderbook.enums.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of an order submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Order submission outcome")
public class OrderSubmittedResponse {

    @Schema(description = "Order ID (bytes32 hex)")
    private String orderId;

    @Schema(description = "FILLED when matched on submission, OPEN otherwise", example = "OPEN")
    private OrderStatus status;

    private boolean matched;

    @Schema(description = "Counter-order the submission was settled against")
    private String counterOrderId;

    private TradeResponse trade;

    public static OrderSubmittedResponse fromMatchResult(MatchResult result) {
        return OrderSubmittedResponse.builder()
                .orderId(result.getIncomingOrder().getOrderId())
                .status(result.getIncomingOrder().getStatus())
                .matched(result.isMatched())
                .counterOrderId(result.isMatched() ? result.getCounterOrder().getOrderId() : null)
                .trade(TradeResponse.fromTrade(result.getTrade()))
                .build();
    }
}
