package defi.protocol.orderbook.strategy;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.OrderBook;

import java.util.Optional;

/**
 * Strategy interface for counter-order selection.
 * Implementations only choose; settlement and index updates are done by the engine.
 */
public interface OrderMatchingStrategy {
    /**
     * Pick the counter-order the incoming order should be settled against
     *
     * @param incomingOrder The newly stored OPEN order
     * @param orderBook The live book of the incoming order's pair
     * @return the selected OPEN counter-order, or empty when nothing is compatible
     */
    Optional<Order> selectCounterOrder(Order incomingOrder, OrderBook orderBook);
}
