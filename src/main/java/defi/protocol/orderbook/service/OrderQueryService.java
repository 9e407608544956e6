package defi.protocol.orderbook.service;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.OrderBookView;
import defi.protocol.orderbook.domain.PairKey;
import defi.protocol.orderbook.domain.Trade;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only views for clients. Queries take no book lock and are never gated.
 */
@Service
public class OrderQueryService {

    @Autowired
    private OrderBookIndex orderBookIndex;

    @Autowired
    private OrderService orderService;

    @Autowired
    private TradeService tradeService;

    /**
     * Both sides of the pair's book in insertion order, including FILLED and CANCELLED orders
     */
    public OrderBookView getOrderBook(String tokenIn, String tokenOut) {
        PairKey pairKey = orderBookIndex.canonicalKey(
                TokenAddresses.normalize(tokenIn, "tokenIn"),
                TokenAddresses.normalize(tokenOut, "tokenOut"));
        return orderBookIndex.view(pairKey);
    }

    /**
     * Ids of every order the user ever submitted, in submission order
     */
    public List<String> getUserOrders(String user) {
        return orderService.getOrderIdsByMaker(user);
    }

    public Order getOrder(String orderId) {
        return orderService.getOrderById(orderId);
    }

    /**
     * Trades the order took part in, as resting or incoming side
     *
     * @throws defi.protocol.orderbook.exception.OrderNotFoundException if no order has this id
     */
    public List<Trade> getOrderTrades(String orderId) {
        Order order = orderService.getOrderById(orderId);
        return tradeService.getTradesByOrderId(order.getOrderId());
    }
}
