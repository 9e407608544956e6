package defi.protocol.orderbook.config;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.enums.OrderStatus;
import defi.protocol.orderbook.mapper.OrderMapper;
import defi.protocol.orderbook.service.CreationClock;
import defi.protocol.orderbook.service.OrderBookIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Application startup runner for order book recovery.
 *
 * On application startup, this component:
 * 1. Moves the creation clock past every stored creation time
 * 2. Loads all OPEN orders from storage, oldest first
 * 3. Rebuilds the live index of every book from them
 */
@Slf4j
@Component
@org.springframework.core.annotation.Order(1)
public class OrderBookRecoveryRunner implements ApplicationRunner {

    @Autowired
    private OrderMapper orderMapper;

    @Autowired
    private OrderBookIndex orderBookIndex;

    @Autowired
    private CreationClock creationClock;

    @Override
    public void run(ApplicationArguments args) {
        log.info("=== Starting Order Book Recovery ===");

        Long maxCreationTime = orderMapper.findMaxCreationTime();
        if (maxCreationTime != null) {
            creationClock.advancePast(maxCreationTime);
        }

        orderBookIndex.clear();
        List<Order> openOrders = orderMapper.findByStatus(OrderStatus.OPEN);
        if (openOrders.isEmpty()) {
            log.info("No open orders found, nothing to recover");
            return;
        }

        for (Order order : openOrders) {
            orderBookIndex.append(
                    orderBookIndex.canonicalKey(order.getTokenIn(), order.getTokenOut()), order);
        }

        log.info("=== Order Book Recovery Complete: books={}, openOrders={} ===",
                orderBookIndex.getOrderBooks().size(), openOrders.size());
    }
}
