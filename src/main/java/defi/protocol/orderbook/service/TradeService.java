package defi.protocol.orderbook.service;

import defi.protocol.orderbook.domain.Trade;
import defi.protocol.orderbook.mapper.TradeMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Service for Trade entity management
 * Handles trade recording and per-order trade history
 */
@Slf4j
@Service
public class TradeService {

    @Autowired
    private TradeMapper tradeMapper;

    /**
     * Create and persist a new trade
     *
     * @param trade the trade to create
     * @return the created trade with generated ID
     */
    public Trade createTrade(Trade trade) {
        if (trade.getCreatedAt() == null) {
            trade.setCreatedAt(LocalDateTime.now());
        }

        int result = tradeMapper.insert(trade);
        if (result <= 0) {
            throw new IllegalStateException("Failed to create trade: buyOrderId=" + trade.getBuyOrderId()
                    + ", sellOrderId=" + trade.getSellOrderId());
        }

        log.info("Trade created: tradeId={}, pairKey={}, buyOrderId={}, sellOrderId={}, price={}",
                trade.getTradeId(), trade.getPairKey(), trade.getBuyOrderId(),
                trade.getSellOrderId(), trade.getExecutionPrice());
        return trade;
    }

    /**
     * Get all trades for a specific order (as buy or sell order)
     */
    public List<Trade> getTradesByOrderId(String orderId) {
        return tradeMapper.findByOrderId(orderId.toLowerCase());
    }
}
