package defi.protocol.orderbook.service;

import defi.protocol.orderbook.access.AccessGate;
import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.OrderBook;
import defi.protocol.orderbook.domain.PairKey;
import defi.protocol.orderbook.domain.Trade;
import defi.protocol.orderbook.dto.MatchResult;
import defi.protocol.orderbook.enums.GatedOperation;
import defi.protocol.orderbook.enums.MatchingPolicy;
import defi.protocol.orderbook.enums.OrderSide;
import defi.protocol.orderbook.exception.TransferFailureException;
import defi.protocol.orderbook.strategy.OrderMatchingStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

/**
 * Core matching engine service.
 *
 * Every submission and cancellation holds the monitor of its pair's {@link OrderBook}
 * for the whole operation, and writes storage in one transaction inside it. The live
 * index is only touched after that transaction commits, so a rolled-back settlement
 * leaves both storage and index as they were. Different pairs proceed concurrently.
 */
@Slf4j
@Service
public class MatchingEngineService {

    @Autowired
    private Map<MatchingPolicy, OrderMatchingStrategy> strategies;

    @Autowired
    private OrderService orderService;

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private OrderBookIndex orderBookIndex;

    @Autowired
    private AccessGate accessGate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private MeterRegistry meterRegistry;

    @Value("${orderbook.matching.policy:FIFO}")
    private MatchingPolicy matchingPolicy;

    private Counter ordersSubmittedCounter;
    private Counter ordersMatchedCounter;
    private Counter ordersCancelledCounter;
    private Counter settlementFailuresCounter;
    private Timer matchTimer;

    @PostConstruct
    public void initMetrics() {
        ordersSubmittedCounter = Counter.builder("orderbook.orders.submitted")
                .description("Orders accepted and stored")
                .register(meterRegistry);

        ordersMatchedCounter = Counter.builder("orderbook.orders.matched")
                .description("Submissions settled against a counter-order")
                .tag("policy", matchingPolicy.name())
                .register(meterRegistry);

        ordersCancelledCounter = Counter.builder("orderbook.orders.cancelled")
                .description("Orders cancelled by their maker")
                .register(meterRegistry);

        settlementFailuresCounter = Counter.builder("orderbook.settlement.failures")
                .description("Submissions rolled back because a ledger transfer was refused")
                .register(meterRegistry);

        matchTimer = Timer.builder("orderbook.match.time")
                .description("Time taken to store, match and settle one submission")
                .tag("policy", matchingPolicy.name())
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        log.info("Matching engine started: policy={}", matchingPolicy);
    }

    /**
     * Store a new order and make exactly one match attempt for it
     *
     * @param maker account submitting the order
     * @param tokenIn token offered
     * @param tokenOut token demanded
     * @param amountIn quantity offered
     * @param amountOut minimum quantity demanded
     * @param side BUY or SELL
     * @return the stored order and the trade, if one executed
     */
    public MatchResult submitOrder(String maker, String tokenIn, String tokenOut,
                                   BigInteger amountIn, BigInteger amountOut, OrderSide side) {
        accessGate.checkPermitted(GatedOperation.CREATE_ORDER);

        PairKey pairKey = orderBookIndex.canonicalKey(
                TokenAddresses.normalize(tokenIn, "tokenIn"),
                TokenAddresses.normalize(tokenOut, "tokenOut"));
        OrderBook orderBook = orderBookIndex.getOrCreateOrderBook(pairKey);

        Timer.Sample sample = Timer.start(meterRegistry);
        synchronized (orderBook) {
            MatchResult result;
            try {
                result = transactionTemplate.execute(status -> {
                    Order order = orderService.createOrder(maker, tokenIn, tokenOut, amountIn, amountOut, side);
                    return executeMatch(order, orderBook);
                });
            } catch (TransferFailureException e) {
                settlementFailuresCounter.increment();
                log.warn("Submission rolled back, settlement refused: maker={}, pairKey={}, reason={}",
                        maker, pairKey, e.getMessage());
                throw e;
            }

            if (result.isMatched()) {
                orderBookIndex.remove(result.getCounterOrder());
                ordersMatchedCounter.increment();
            } else {
                orderBookIndex.append(pairKey, result.getIncomingOrder());
            }
            ordersSubmittedCounter.increment();
            sample.stop(matchTimer);

            log.info("Order processing complete: orderId={}, status={}, matched={}, openInBook={}",
                    result.getIncomingOrder().getOrderId(), result.getIncomingOrder().getStatus(),
                    result.isMatched(), orderBook.openOrderCount());
            return result;
        }
    }

    /**
     * Cancel an OPEN order; only its maker may do so
     *
     * @return the cancelled order
     */
    public Order cancelOrder(String orderId, String caller) {
        accessGate.checkPermitted(GatedOperation.CANCEL_ORDER);

        Order stored = orderService.getOrderById(orderId);
        OrderBook orderBook = orderBookIndex.getOrCreateOrderBook(
                orderBookIndex.canonicalKey(stored.getTokenIn(), stored.getTokenOut()));

        synchronized (orderBook) {
            Order cancelled = transactionTemplate.execute(status -> orderService.cancelOrder(orderId, caller));
            orderBookIndex.remove(cancelled);
            ordersCancelledCounter.increment();
            return cancelled;
        }
    }

    /**
     * Select a counter-order with the configured strategy and settle against it.
     * Runs inside the submission's transaction while holding the book's monitor.
     */
    private MatchResult executeMatch(Order order, OrderBook orderBook) {
        OrderMatchingStrategy strategy = strategies.get(matchingPolicy);
        if (strategy == null) {
            throw new IllegalStateException("No matching strategy found for policy: " + matchingPolicy);
        }

        Optional<Order> counter = strategy.selectCounterOrder(order, orderBook);
        if (counter.isEmpty()) {
            log.debug("No compatible counter-order for {}, resting on {} side", order.getOrderId(), order.getSide());
            return MatchResult.unmatched(order);
        }

        // settle a copy, the indexed instance must stay OPEN if the transaction rolls back
        Order counterOrder = counter.get().toBuilder().build();
        Trade trade = settlementService.settle(order, counterOrder);
        return MatchResult.matched(order, counterOrder, trade);
    }

    public MatchingPolicy getMatchingPolicy() {
        return matchingPolicy;
    }
}
