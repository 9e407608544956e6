package defi.protocol.orderbook.controller;

import defi.protocol.orderbook.access.PauseAccessGate;
import defi.protocol.orderbook.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator switch for order submission and cancellation.
 * Only registered when orderbook.admin.enabled is true.
 */
@Slf4j
@RestController
@ConditionalOnProperty(name = "orderbook.admin.enabled", havingValue = "true")
@RequestMapping("/api/v1/admin")
@Tag(name = "Admin", description = "Operator APIs")
public class AdminController {

    @Autowired
    private PauseAccessGate pauseAccessGate;

    @PostMapping("/pause")
    @Operation(summary = "Pause", description = "Reject new orders and cancellations until unpaused")
    public ApiResponse<Map<String, Boolean>> pause() {
        pauseAccessGate.pause();
        return ApiResponse.success("Order book paused", state());
    }

    @PostMapping("/unpause")
    @Operation(summary = "Unpause", description = "Accept orders and cancellations again")
    public ApiResponse<Map<String, Boolean>> unpause() {
        pauseAccessGate.unpause();
        return ApiResponse.success("Order book unpaused", state());
    }

    @GetMapping("/status")
    public ApiResponse<Map<String, Boolean>> status() {
        return ApiResponse.success(state());
    }

    private Map<String, Boolean> state() {
        return Map.of("paused", pauseAccessGate.isPaused());
    }
}
