package defi.protocol.orderbook.event;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.UUID;

/**
 * Event published when a match is settled.
 * orderId and maker belong to the order whose submission triggered the match;
 * taker is the maker of the resting counter-order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeExecutedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Unique message ID for consumer-side deduplication (UUID)
     */
    private String messageId;

    /**
     * Event timestamp in epoch milliseconds
     */
    private Long timestamp;

    private Long tradeId;

    private String pairKey;

    /**
     * Triggering order ID
     */
    private String orderId;

    private String maker;

    private String taker;

    /**
     * Amount of tokenIn the triggering order delivered
     */
    private BigInteger amount;

    /**
     * Execution price scaled by 1e18
     */
    private BigInteger price;

    /**
     * Create event from a settled trade
     *
     * @param trade the persisted trade
     * @param incoming the order that triggered the match
     * @param counter the resting order it matched
     * @return TradeExecutedEvent
     */
    public static TradeExecutedEvent fromTrade(Trade trade, Order incoming, Order counter) {
        return TradeExecutedEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .tradeId(trade.getTradeId())
                .pairKey(trade.getPairKey())
                .orderId(incoming.getOrderId())
                .maker(incoming.getMaker())
                .taker(counter.getMaker())
                .amount(incoming.getAmountIn())
                .price(trade.getExecutionPrice())
                .build();
    }
}
