package defi.protocol.orderbook.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Trade entity representing a settled match between a buy and a sell order
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {
    /**
     * Unique trade identifier
     */
    private Long tradeId;

    /**
     * Canonical key of the book the trade happened in
     */
    private String pairKey;

    /**
     * Buy order that was matched
     */
    private String buyOrderId;

    /**
     * Sell order that was matched
     */
    private String sellOrderId;

    /**
     * Maker of the buy order
     */
    private String buyer;

    /**
     * Maker of the sell order
     */
    private String seller;

    /**
     * Token and amount the buyer delivered to the seller
     */
    private String buyerToken;

    private BigInteger buyerAmount;

    /**
     * Token and amount the seller delivered to the buyer
     */
    private String sellerToken;

    private BigInteger sellerAmount;

    /**
     * Execution price derived from the sell order, scaled by 1e18
     */
    private BigInteger executionPrice;

    /**
     * Order whose submission triggered the match
     */
    private String triggeringOrderId;

    /**
     * Timestamp when trade was executed
     */
    private LocalDateTime createdAt;
}
