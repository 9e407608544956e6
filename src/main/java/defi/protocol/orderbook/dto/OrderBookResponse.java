package defi.protocol.orderbook.dto;

import defi.protocol.orderbook.domain.OrderBookView;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Both sides of a pair's book in insertion order, every status included
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Order book of a token pair")
public class OrderBookResponse {

    private String pairKey;

    @Schema(description = "Numerically lower token of the pair")
    private String token0;

    private String token1;

    private List<OrderResponse> buyOrders;

    private List<OrderResponse> sellOrders;

    public static OrderBookResponse fromView(OrderBookView view) {
        return OrderBookResponse.builder()
                .pairKey(view.getPairKey().getKey())
                .token0(view.getPairKey().getToken0())
                .token1(view.getPairKey().getToken1())
                .buyOrders(view.getBuyOrders().stream().map(OrderResponse::fromOrder).collect(Collectors.toList()))
                .sellOrders(view.getSellOrders().stream().map(OrderResponse::fromOrder).collect(Collectors.toList()))
                .build();
    }
}
