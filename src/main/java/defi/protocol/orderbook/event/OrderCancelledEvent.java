package defi.protocol.orderbook.event;

import defi.protocol.orderbook.domain.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.UUID;

/**
 * Event published when a maker cancels an OPEN order
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderCancelledEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String messageId;

    private Long timestamp;

    private String orderId;

    private String maker;

    private String pairKey;

    public static OrderCancelledEvent fromOrder(Order order) {
        return OrderCancelledEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .orderId(order.getOrderId())
                .maker(order.getMaker())
                .pairKey(order.getPairKey())
                .build();
    }
}
