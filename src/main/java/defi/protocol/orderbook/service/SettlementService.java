package defi.protocol.orderbook.service;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.Trade;
import defi.protocol.orderbook.enums.OrderSide;
import defi.protocol.orderbook.event.TradeExecutedEvent;
import defi.protocol.orderbook.exception.InvalidOrderStateException;
import defi.protocol.orderbook.ledger.TokenLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Settles a matched pair of orders: both ledger transfers, both FILLED writes and the
 * trade record. Always joins the caller's transaction, so a refused transfer undoes
 * everything the submission wrote, including the incoming order itself.
 */
@Slf4j
@Service
public class SettlementService {

    /**
     * Fixed-point scale of execution prices
     */
    public static final BigInteger PRICE_SCALE = BigInteger.TEN.pow(18);

    @Autowired
    private TokenLedger tokenLedger;

    @Autowired
    private OrderService orderService;

    @Autowired
    private TradeService tradeService;

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    /**
     * Swap the offered amounts of two compatible OPEN orders
     *
     * @param incoming the order whose submission triggered the match
     * @param counter the resting counter-order
     * @return the recorded trade
     * @throws defi.protocol.orderbook.exception.TransferFailureException if either transfer is refused
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Trade settle(Order incoming, Order counter) {
        if (incoming.getSide() == counter.getSide()) {
            throw new InvalidOrderStateException("Cannot settle two " + incoming.getSide() + " orders: "
                    + incoming.getOrderId() + ", " + counter.getOrderId());
        }
        Order buy = incoming.getSide() == OrderSide.BUY ? incoming : counter;
        Order sell = incoming.getSide() == OrderSide.BUY ? counter : incoming;

        log.debug("Settling buy {} against sell {}", buy.getOrderId(), sell.getOrderId());

        tokenLedger.transferFrom(incoming.getTokenIn(), incoming.getMaker(), counter.getMaker(), incoming.getAmountIn());
        tokenLedger.transferFrom(counter.getTokenIn(), counter.getMaker(), incoming.getMaker(), counter.getAmountIn());

        orderService.markFilled(counter);
        orderService.markFilled(incoming);

        Trade trade = tradeService.createTrade(Trade.builder()
                .pairKey(incoming.getPairKey())
                .buyOrderId(buy.getOrderId())
                .sellOrderId(sell.getOrderId())
                .buyer(buy.getMaker())
                .seller(sell.getMaker())
                .buyerToken(buy.getTokenIn())
                .buyerAmount(buy.getAmountIn())
                .sellerToken(sell.getTokenIn())
                .sellerAmount(sell.getAmountIn())
                .executionPrice(executionPrice(sell))
                .triggeringOrderId(incoming.getOrderId())
                .build());

        eventPublisher.publishEvent(TradeExecutedEvent.fromTrade(trade, incoming, counter));

        log.info("Settled: tradeId={}, buyer={} paid {} {}, seller={} paid {} {}",
                trade.getTradeId(), trade.getBuyer(), trade.getBuyerAmount(), trade.getBuyerToken(),
                trade.getSeller(), trade.getSellerAmount(), trade.getSellerToken());
        return trade;
    }

    /**
     * sell.amountOut * 1e18 / sell.amountIn, rounded down
     */
    static BigInteger executionPrice(Order sell) {
        return sell.getAmountOut().multiply(PRICE_SCALE).divide(sell.getAmountIn());
    }
}
