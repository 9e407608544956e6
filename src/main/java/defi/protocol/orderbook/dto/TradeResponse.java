package defi.protocol.orderbook.dto;

import defi.protocol.orderbook.domain.Trade;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Trade response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Settled trade")
public class TradeResponse {

    private Long tradeId;

    private String pairKey;

    private String buyOrderId;

    private String sellOrderId;

    private String buyer;

    private String seller;

    private String buyerToken;

    @Schema(description = "Amount of buyerToken moved from buyer to seller", example = "1000")
    private String buyerAmount;

    private String sellerToken;

    @Schema(description = "Amount of sellerToken moved from seller to buyer", example = "800")
    private String sellerAmount;

    @Schema(description = "Sell order's amountOut / amountIn scaled by 1e18", example = "1125000000000000000")
    private String executionPrice;

    private String triggeringOrderId;

    private LocalDateTime createdAt;

    public static TradeResponse fromTrade(Trade trade) {
        if (trade == null) {
            return null;
        }

        return TradeResponse.builder()
                .tradeId(trade.getTradeId())
                .pairKey(trade.getPairKey())
                .buyOrderId(trade.getBuyOrderId())
                .sellOrderId(trade.getSellOrderId())
                .buyer(trade.getBuyer())
                .seller(trade.getSeller())
                .buyerToken(trade.getBuyerToken())
                .buyerAmount(trade.getBuyerAmount().toString())
                .sellerToken(trade.getSellerToken())
                .sellerAmount(trade.getSellerAmount().toString())
                .executionPrice(trade.getExecutionPrice().toString())
                .triggeringOrderId(trade.getTriggeringOrderId())
                .createdAt(trade.getCreatedAt())
                .build();
    }
}
