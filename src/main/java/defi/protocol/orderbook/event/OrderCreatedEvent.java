package defi.protocol.orderbook.event;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.enums.OrderSide;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.UUID;

/**
 * Event published when a new order is stored OPEN
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderCreatedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Unique message ID for consumer-side deduplication (UUID)
     */
    private String messageId;

    /**
     * Event timestamp in epoch milliseconds
     */
    private Long timestamp;

    private String orderId;

    private String maker;

    private String pairKey;

    private String tokenIn;

    private String tokenOut;

    private BigInteger amountIn;

    private BigInteger amountOut;

    private OrderSide side;

    /**
     * Create event from Order entity
     */
    public static OrderCreatedEvent fromOrder(Order order) {
        return OrderCreatedEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .orderId(order.getOrderId())
                .maker(order.getMaker())
                .pairKey(order.getPairKey())
                .tokenIn(order.getTokenIn())
                .tokenOut(order.getTokenOut())
                .amountIn(order.getAmountIn())
                .amountOut(order.getAmountOut())
                .side(order.getSide())
                .build();
    }
}
