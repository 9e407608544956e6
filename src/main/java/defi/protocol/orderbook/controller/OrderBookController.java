package defi.protocol.orderbook.controller;

import defi.protocol.orderbook.dto.ApiResponse;
import defi.protocol.orderbook.dto.OrderBookResponse;
import defi.protocol.orderbook.service.OrderQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for order book queries
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/orderbook")
@Validated
@Tag(name = "Order Book", description = "APIs for order book queries")
public class OrderBookController {

    @Autowired
    private OrderQueryService orderQueryService;

    /**
     * Get the book of a pair. Token order does not matter.
     */
    @GetMapping
    @Operation(summary = "Get order book",
               description = "Both sides of the pair's book in insertion order, FILLED and CANCELLED orders included")
    public ApiResponse<OrderBookResponse> getOrderBook(
            @Parameter(description = "One token of the pair", required = true)
            @RequestParam @NotBlank String tokenIn,
            @Parameter(description = "The other token of the pair", required = true)
            @RequestParam @NotBlank String tokenOut) {
        log.debug("Querying order book: tokenIn={}, tokenOut={}", tokenIn, tokenOut);
        return ApiResponse.success(OrderBookResponse.fromView(orderQueryService.getOrderBook(tokenIn, tokenOut)));
    }
}
