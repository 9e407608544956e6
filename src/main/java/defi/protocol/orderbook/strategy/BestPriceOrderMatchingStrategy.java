package defi.protocol.orderbook.strategy;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.OrderBook;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Price-time selection: walks counter-orders offering the incoming order's tokenOut,
 * lowest ask (amountOut / amountIn) first and oldest first among equal asks.
 * Stops at the first incompatible ask since every later one is worse.
 */
@Slf4j
@Component
public class BestPriceOrderMatchingStrategy implements OrderMatchingStrategy {

    @Override
    public Optional<Order> selectCounterOrder(Order incomingOrder, OrderBook orderBook) {
        Iterable<Order> candidates = orderBook.side(incomingOrder.getSide().opposite())
                .byPriceOffering(incomingOrder.getTokenOut());

        for (Order candidate : candidates) {
            if (!PriceCompatibility.isEligible(incomingOrder, candidate)) {
                continue;
            }
            if (!PriceCompatibility.isCompatible(incomingOrder, candidate)) {
                log.debug("No more matches for {}: best remaining ask {}/{} too high",
                        incomingOrder.getOrderId(), candidate.getAmountOut(), candidate.getAmountIn());
                break;
            }
            log.debug("Best-price match for {}: counterOrder={}",
                    incomingOrder.getOrderId(), candidate.getOrderId());
            return Optional.of(candidate);
        }
        return Optional.empty();
    }
}
