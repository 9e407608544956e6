package defi.protocol.orderbook.strategy;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.OrderBook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Default selection policy: the oldest compatible counter-order wins, whatever its price.
 * Incompatible candidates are skipped, not treated as the end of the scan.
 */
@Slf4j
@Component
public class FifoOrderMatchingStrategy implements OrderMatchingStrategy {

    @Override
    public Optional<Order> selectCounterOrder(Order incomingOrder, OrderBook orderBook) {
        int scanned = 0;
        for (Order candidate : orderBook.side(incomingOrder.getSide().opposite()).inInsertionOrder()) {
            scanned++;
            if (!PriceCompatibility.isEligible(incomingOrder, candidate)) {
                continue;
            }
            if (PriceCompatibility.isCompatible(incomingOrder, candidate)) {
                log.debug("FIFO match for {}: counterOrder={}, scanned={}",
                        incomingOrder.getOrderId(), candidate.getOrderId(), scanned);
                return Optional.of(candidate);
            }
        }

        log.debug("No FIFO match for {}: scanned={}", incomingOrder.getOrderId(), scanned);
        return Optional.empty();
    }
}
