package defi.protocol.orderbook.domain;

import defi.protocol.orderbook.enums.OrderSide;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Live matching index of one canonical pair: the open orders of both sides.
 * Matching and cancellation on a pair synchronize on its OrderBook instance.
 */
@Getter
@ToString(of = {"pairKey", "updatedAt"})
public class OrderBook {

    private final PairKey pairKey;

    /**
     * Open buy orders
     */
    private final BookSide buyOrders = new BookSide();

    /**
     * Open sell orders
     */
    private final BookSide sellOrders = new BookSide();

    private volatile LocalDateTime updatedAt;

    public OrderBook(PairKey pairKey) {
        this.pairKey = pairKey;
        this.updatedAt = LocalDateTime.now();
    }

    public BookSide side(OrderSide side) {
        return side == OrderSide.BUY ? buyOrders : sellOrders;
    }

    public void add(Order order) {
        side(order.getSide()).add(order);
        updatedAt = LocalDateTime.now();
    }

    public boolean remove(Order order) {
        boolean removed = side(order.getSide()).remove(order);
        if (removed) {
            updatedAt = LocalDateTime.now();
        }
        return removed;
    }

    public int openOrderCount() {
        return buyOrders.size() + sellOrders.size();
    }
}
