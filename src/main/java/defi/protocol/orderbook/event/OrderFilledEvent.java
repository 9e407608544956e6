package defi.protocol.orderbook.event;

import defi.protocol.orderbook.domain.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.UUID;

/**
 * Event published when an order is settled.
 * fillAmount is always the order's full amountIn: orders are never partially filled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderFilledEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private String messageId;

    private Long timestamp;

    private String orderId;

    private String maker;

    private String pairKey;

    private BigInteger fillAmount;

    public static OrderFilledEvent fromOrder(Order order) {
        return OrderFilledEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .orderId(order.getOrderId())
                .maker(order.getMaker())
                .pairKey(order.getPairKey())
                .fillAmount(order.getAmountIn())
                .build();
    }
}
