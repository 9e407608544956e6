package defi.protocol.orderbook.controller;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.dto.ApiResponse;
import defi.protocol.orderbook.dto.CreateOrderRequest;
import defi.protocol.orderbook.dto.MatchResult;
import defi.protocol.orderbook.dto.OrderResponse;
import defi.protocol.orderbook.dto.OrderSubmittedResponse;
import defi.protocol.orderbook.dto.TradeResponse;
import defi.protocol.orderbook.enums.OrderSide;
import defi.protocol.orderbook.service.MatchingEngineService;
import defi.protocol.orderbook.service.OrderQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST Controller for Order management
 * Handles order submission, query, and cancellation operations
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/orders")
@Validated
@Tag(name = "Order Management", description = "APIs for order operations")
public class OrderController {

    static final String ACCOUNT_HEADER = "X-Account-Address";

    @Autowired
    private MatchingEngineService matchingEngineService;

    @Autowired
    private OrderQueryService orderQueryService;

    /**
     * Submit a new order. The order is matched synchronously against the opposite side.
     *
     * @param caller the submitting account, becomes the order's maker
     * @param request the create order request
     * @return API response with the order id, its status and the trade if one executed
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
        summary = "Submit a new order",
        description = "Stores an OPEN order and makes one match attempt against the opposite side of the pair. " +
                      "When a compatible counter-order exists both are settled through the token ledger and become FILLED."
    )
    public ApiResponse<OrderSubmittedResponse> createOrder(
            @Parameter(description = "Submitting account address", required = true)
            @RequestHeader(ACCOUNT_HEADER) @NotBlank String caller,
            @Valid @RequestBody CreateOrderRequest request) {

        log.info("Received create order request: caller={}, {}", caller, request);

        MatchResult result = matchingEngineService.submitOrder(
                caller,
                request.getTokenIn(),
                request.getTokenOut(),
                request.amountInValue(),
                request.amountOutValue(),
                OrderSide.fromBuyFlag(request.getIsBuyOrder()));

        OrderSubmittedResponse response = OrderSubmittedResponse.fromMatchResult(result);
        return ApiResponse.success(result.isMatched() ? "Order matched" : "Order placed", response);
    }

    /**
     * Query order by ID
     */
    @GetMapping("/{orderId}")
    @Operation(summary = "Query order by ID", description = "Retrieve order details by order ID")
    public ApiResponse<OrderResponse> getOrder(
            @Parameter(description = "Order ID", required = true)
            @PathVariable @NotBlank String orderId) {

        log.debug("Querying order: orderId={}", orderId);
        return ApiResponse.success(OrderResponse.fromOrder(orderQueryService.getOrder(orderId)));
    }

    @GetMapping("/{orderId}/trades")
    @Operation(summary = "Query trades of an order", description = "Trades the order took part in, oldest first")
    public ApiResponse<List<TradeResponse>> getOrderTrades(
            @Parameter(description = "Order ID", required = true)
            @PathVariable @NotBlank String orderId) {

        List<TradeResponse> trades = orderQueryService.getOrderTrades(orderId).stream()
                .map(TradeResponse::fromTrade)
                .collect(Collectors.toList());
        return ApiResponse.success(trades);
    }

    /**
     * Cancel an order
     *
     * @param orderId the order ID to cancel
     * @param caller the account asking for cancellation, must be the maker
     * @return API response with cancelled order details
     */
    @DeleteMapping("/{orderId}")
    @Operation(
        summary = "Cancel an order",
        description = "Cancel an OPEN order. Only the order's maker can cancel it. No funds move."
    )
    public ApiResponse<OrderResponse> cancelOrder(
            @Parameter(description = "Order ID", required = true)
            @PathVariable @NotBlank String orderId,
            @Parameter(description = "Caller account address", required = true)
            @RequestHeader(ACCOUNT_HEADER) @NotBlank String caller) {

        log.info("Received cancel order request: orderId={}, caller={}", orderId, caller);

        Order cancelledOrder = matchingEngineService.cancelOrder(orderId, caller);
        return ApiResponse.success("Order cancelled successfully", OrderResponse.fromOrder(cancelledOrder));
    }
}
