package defi.protocol.orderbook.domain;

import lombok.Value;

import java.util.List;

/**
 * Full history of one book: every order ever appended to each side,
 * in insertion order, whatever its status
 */
@Value
public class OrderBookView {

    PairKey pairKey;

    List<Order> buyOrders;

    List<Order> sellOrders;
}
