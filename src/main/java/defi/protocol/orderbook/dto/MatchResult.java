package defi.protocol.orderbook.dto;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.Trade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one submission: the stored order and, when a counter-order was found, the settlement
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {
    /**
     * The submitted order, FILLED when matched, OPEN otherwise
     */
    private Order incomingOrder;

    /**
     * The resting order it was settled against, null when unmatched
     */
    private Order counterOrder;

    /**
     * The recorded trade, null when unmatched
     */
    private Trade trade;

    public boolean isMatched() {
        return trade != null;
    }

    public static MatchResult unmatched(Order incomingOrder) {
        return MatchResult.builder().incomingOrder(incomingOrder).build();
    }

    public static MatchResult matched(Order incomingOrder, Order counterOrder, Trade trade) {
        return MatchResult.builder()
                .incomingOrder(incomingOrder)
                .counterOrder(counterOrder)
                .trade(trade)
                .build();
    }
}
