package defi.protocol.orderbook.service;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.PairKey;
import defi.protocol.orderbook.enums.OrderSide;
import defi.protocol.orderbook.enums.OrderStatus;
import defi.protocol.orderbook.event.OrderCancelledEvent;
import defi.protocol.orderbook.event.OrderCreatedEvent;
import defi.protocol.orderbook.event.OrderFilledEvent;
import defi.protocol.orderbook.exception.InvalidAmountsException;
import defi.protocol.orderbook.exception.InvalidOrderStateException;
import defi.protocol.orderbook.exception.OrderNotFoundException;
import defi.protocol.orderbook.exception.UnauthorizedOrderAccessException;
import defi.protocol.orderbook.ledger.TokenLedger;
import defi.protocol.orderbook.mapper.OrderMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Order store: owns Order records, their ids and their lifecycle writes.
 * Every status write is guarded by status = OPEN, so a terminal order can never change again.
 */
@Slf4j
@Service
public class OrderService {

    @Autowired
    private OrderMapper orderMapper;

    @Autowired
    private OrderBookIndex orderBookIndex;

    @Autowired
    private OrderHashService orderHashService;

    @Autowired
    private CreationClock creationClock;

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    /**
     * Validate and persist a new OPEN order
     *
     * @param maker account that owns the order
     * @param tokenIn token offered
     * @param tokenOut token demanded
     * @param amountIn quantity offered
     * @param amountOut minimum quantity demanded
     * @param side BUY or SELL
     * @return the stored order with its id and sequence
     * @throws defi.protocol.orderbook.exception.InvalidPairException if tokenIn equals tokenOut
     * @throws InvalidAmountsException if an amount is not strictly positive or exceeds the ledger maximum
     */
    @Transactional
    public Order createOrder(String maker, String tokenIn, String tokenOut,
                             BigInteger amountIn, BigInteger amountOut, OrderSide side) {
        String normalizedMaker = TokenAddresses.normalize(maker, "maker");
        String normalizedIn = TokenAddresses.normalize(tokenIn, "tokenIn");
        String normalizedOut = TokenAddresses.normalize(tokenOut, "tokenOut");

        PairKey pairKey = orderBookIndex.canonicalKey(normalizedIn, normalizedOut);
        validateAmounts(amountIn, amountOut);

        long creationTime = creationClock.next();
        LocalDateTime now = LocalDateTime.now();

        Order order = Order.builder()
                .orderId(orderHashService.orderId(normalizedMaker, normalizedIn, normalizedOut,
                        amountIn, amountOut, creationTime))
                .maker(normalizedMaker)
                .tokenIn(normalizedIn)
                .tokenOut(normalizedOut)
                .amountIn(amountIn)
                .amountOut(amountOut)
                .side(side)
                .pairKey(pairKey.getKey())
                .status(OrderStatus.OPEN)
                .creationTime(creationTime)
                .createdAt(now)
                .updatedAt(now)
                .build();

        int result = orderMapper.insert(order);
        if (result <= 0) {
            throw new IllegalStateException("Failed to create order: orderId=" + order.getOrderId());
        }

        eventPublisher.publishEvent(OrderCreatedEvent.fromOrder(order));

        log.info("Order created: orderId={}, maker={}, side={}, {} {} -> {} {}",
                order.getOrderId(), order.getMaker(), order.getSide(),
                order.getAmountIn(), order.getTokenIn(), order.getAmountOut(), order.getTokenOut());
        return order;
    }

    /**
     * Move a matched order to FILLED
     *
     * @throws InvalidOrderStateException if the order is no longer OPEN
     */
    @Transactional
    public void markFilled(Order order) {
        transition(order, OrderStatus.FILLED);
        eventPublisher.publishEvent(OrderFilledEvent.fromOrder(order));
    }

    /**
     * Cancel an OPEN order on behalf of its maker. Moves no funds.
     *
     * @param orderId the order ID to cancel
     * @param caller the account asking for cancellation
     * @return the cancelled order
     * @throws OrderNotFoundException if order not found
     * @throws UnauthorizedOrderAccessException if caller is not the maker
     * @throws InvalidOrderStateException if order is not OPEN
     */
    @Transactional
    public Order cancelOrder(String orderId, String caller) {
        Order order = getOrderById(orderId);

        String normalizedCaller = TokenAddresses.normalize(caller, "caller");
        if (!order.getMaker().equals(normalizedCaller)) {
            throw new UnauthorizedOrderAccessException(
                    "Not authorized to cancel order " + orderId + ": caller=" + normalizedCaller);
        }

        transition(order, OrderStatus.CANCELLED);
        eventPublisher.publishEvent(OrderCancelledEvent.fromOrder(order));

        log.info("Order cancelled: orderId={}, maker={}", orderId, order.getMaker());
        return order;
    }

    /**
     * Get order by ID
     *
     * @throws OrderNotFoundException if no order has this id
     */
    public Order getOrderById(String orderId) {
        return findOrderById(orderId)
                .orElseThrow(() -> new OrderNotFoundException("Order not found: " + orderId));
    }

    public Optional<Order> findOrderById(String orderId) {
        if (orderId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(orderMapper.findById(orderId.toLowerCase()));
    }

    /**
     * All order ids of a maker, in submission order
     */
    public List<String> getOrderIdsByMaker(String maker) {
        return orderMapper.findOrderIdsByMaker(TokenAddresses.normalize(maker, "user"));
    }

    private void transition(Order order, OrderStatus newStatus) {
        if (!order.isOpen()) {
            throw new InvalidOrderStateException(
                    "Order " + order.getOrderId() + " is " + order.getStatus() + ", expected OPEN");
        }

        LocalDateTime now = LocalDateTime.now();
        int result = orderMapper.updateStatus(order.getOrderId(), OrderStatus.OPEN, newStatus, now);
        if (result == 0) {
            // stored row already left OPEN under a concurrent operation
            throw new InvalidOrderStateException(
                    "Order " + order.getOrderId() + " is no longer OPEN");
        }

        OrderStatus oldStatus = order.getStatus();
        order.setStatus(newStatus);
        order.setUpdatedAt(now);
        log.debug("Order status changed: orderId={}, {} -> {}", order.getOrderId(), oldStatus, newStatus);
    }

    private void validateAmounts(BigInteger amountIn, BigInteger amountOut) {
        if (amountIn == null || amountOut == null
                || amountIn.signum() <= 0 || amountOut.signum() <= 0) {
            throw new InvalidAmountsException(
                    "amountIn and amountOut must be positive: amountIn=" + amountIn + ", amountOut=" + amountOut);
        }
        if (amountIn.compareTo(TokenLedger.MAX_AMOUNT) > 0 || amountOut.compareTo(TokenLedger.MAX_AMOUNT) > 0) {
            throw new InvalidAmountsException("amounts must not exceed " + TokenLedger.MAX_AMOUNT);
        }
    }
}
