package defi.protocol.orderbook.controller;

import defi.protocol.orderbook.dto.ApiResponse;
import defi.protocol.orderbook.service.OrderQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for per-account order queries
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/users")
@Validated
@Tag(name = "User Orders", description = "APIs for querying an account's orders")
public class UserOrderController {

    @Autowired
    private OrderQueryService orderQueryService;

    @GetMapping("/{address}/orders")
    @Operation(summary = "List a user's order IDs",
               description = "Every order the account ever submitted, in submission order, whatever its status")
    public ApiResponse<List<String>> getUserOrders(
            @Parameter(description = "Account address", required = true)
            @PathVariable @NotBlank String address) {
        log.debug("Querying orders of {}", address);
        return ApiResponse.success(orderQueryService.getUserOrders(address));
    }
}
