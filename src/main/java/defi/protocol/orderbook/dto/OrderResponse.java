package defi.protocol.orderbook.dto;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.enums.OrderSide;
import defi.protocol.orderbook.enums.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Order response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Order response")
public class OrderResponse {

    @Schema(description = "Order ID (bytes32 hex)")
    private String orderId;

    @Schema(description = "Position in the book's insertion order", example = "42")
    private Long sequence;

    private String maker;

    private String tokenIn;

    private String tokenOut;

    @Schema(description = "Quantity of tokenIn offered", example = "1000")
    private String amountIn;

    @Schema(description = "Minimum quantity of tokenOut demanded", example = "800")
    private String amountOut;

    @Schema(description = "Order side", example = "BUY")
    private OrderSide side;

    private String pairKey;

    @Schema(description = "Order status", example = "OPEN")
    private OrderStatus status;

    @Schema(description = "Logical creation time in epoch millis")
    private Long creationTime;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * Convert Order entity to OrderResponse DTO
     */
    public static OrderResponse fromOrder(Order order) {
        if (order == null) {
            return null;
        }

        return OrderResponse.builder()
                .orderId(order.getOrderId())
                .sequence(order.getSequence())
                .maker(order.getMaker())
                .tokenIn(order.getTokenIn())
                .tokenOut(order.getTokenOut())
                .amountIn(order.getAmountIn().toString())
                .amountOut(order.getAmountOut().toString())
                .side(order.getSide())
                .pairKey(order.getPairKey())
                .status(order.getStatus())
                .creationTime(order.getCreationTime())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
