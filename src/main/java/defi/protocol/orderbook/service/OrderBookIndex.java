package defi.protocol.orderbook.service;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.OrderBook;
import defi.protocol.orderbook.domain.OrderBookView;
import defi.protocol.orderbook.domain.PairKey;
import defi.protocol.orderbook.enums.OrderSide;
import defi.protocol.orderbook.exception.InvalidPairException;
import defi.protocol.orderbook.mapper.OrderMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps canonical pair keys to books.
 *
 * The persistent side sequences live in the orders table (pair_key, side, sequence)
 * and are append-only. The in-memory {@link OrderBook} per pair holds only OPEN
 * orders and is the candidate set the matching engine scans.
 */
@Slf4j
@Service
public class OrderBookIndex {

    @Autowired
    private OrderMapper orderMapper;

    @Autowired
    private OrderHashService orderHashService;

    private final ConcurrentMap<String, OrderBook> books = new ConcurrentHashMap<>();

    /**
     * Canonical key of a pair, independent of argument order
     *
     * @param tokenA normalized token address
     * @param tokenB normalized token address
     * @return the pair key
     * @throws InvalidPairException if both tokens are the same
     */
    public PairKey canonicalKey(String tokenA, String tokenB) {
        int cmp = TokenAddresses.NUMERIC_ORDER.compare(tokenA, tokenB);
        if (cmp == 0) {
            throw new InvalidPairException("tokenIn and tokenOut must differ: " + tokenA);
        }
        String token0 = cmp < 0 ? tokenA : tokenB;
        String token1 = cmp < 0 ? tokenB : tokenA;
        return new PairKey(orderHashService.pairKey(token0, token1), token0, token1);
    }

    /**
     * Get or create the live book of a pair
     */
    public OrderBook getOrCreateOrderBook(PairKey pairKey) {
        return books.computeIfAbsent(pairKey.getKey(), k -> {
            log.info("Created order book: pairKey={}, token0={}, token1={}",
                    pairKey.getKey(), pairKey.getToken0(), pairKey.getToken1());
            return new OrderBook(pairKey);
        });
    }

    public Optional<OrderBook> findOrderBook(String pairKey) {
        return Optional.ofNullable(books.get(pairKey));
    }

    /**
     * Add an OPEN order to the candidate set of its side.
     * The persistent sequence entry is written by the order store on insert.
     */
    public void append(PairKey pairKey, Order order) {
        if (!order.isOpen()) {
            log.debug("Order {} is {}, not indexed", order.getOrderId(), order.getStatus());
            return;
        }
        getOrCreateOrderBook(pairKey).add(order);
        log.debug("Indexed order {} on {} side of book {}",
                order.getOrderId(), order.getSide(), pairKey.getKey());
    }

    /**
     * Drop an order that left OPEN from the candidate set
     */
    public void remove(Order order) {
        OrderBook book = books.get(order.getPairKey());
        if (book != null && book.remove(order)) {
            log.debug("Removed order {} from book {}", order.getOrderId(), order.getPairKey());
        }
    }

    /**
     * Both side sequences of a book verbatim, including FILLED and CANCELLED entries
     */
    public OrderBookView view(PairKey pairKey) {
        return new OrderBookView(
                pairKey,
                orderMapper.findByPairKeyAndSide(pairKey.getKey(), OrderSide.BUY),
                orderMapper.findByPairKeyAndSide(pairKey.getKey(), OrderSide.SELL));
    }

    public Collection<OrderBook> getOrderBooks() {
        return books.values();
    }

    /**
     * Drop every live book (recovery and tests)
     */
    public void clear() {
        books.clear();
    }
}
