package defi.protocol.orderbook.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Create order request DTO.
 * Amounts are decimal strings so that full 256-bit values survive JSON clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create order request")
public class CreateOrderRequest {

    @NotBlank(message = "tokenIn cannot be blank")
    @Pattern(regexp = Patterns.ADDRESS, message = "tokenIn must be a 0x-prefixed 20-byte hex address")
    @Schema(description = "Token offered", example = "0x1000000000000000000000000000000000000001", required = true)
    private String tokenIn;

    @NotBlank(message = "tokenOut cannot be blank")
    @Pattern(regexp = Patterns.ADDRESS, message = "tokenOut must be a 0x-prefixed 20-byte hex address")
    @Schema(description = "Token demanded", example = "0x2000000000000000000000000000000000000002", required = true)
    private String tokenOut;

    @NotBlank(message = "amountIn cannot be blank")
    @Pattern(regexp = Patterns.UINT, message = "amountIn must be an unsigned integer")
    @Schema(description = "Quantity of tokenIn offered", example = "1000", required = true)
    private String amountIn;

    @NotBlank(message = "amountOut cannot be blank")
    @Pattern(regexp = Patterns.UINT, message = "amountOut must be an unsigned integer")
    @Schema(description = "Minimum quantity of tokenOut demanded", example = "800", required = true)
    private String amountOut;

    @NotNull(message = "isBuyOrder cannot be null")
    @Schema(description = "true for a BUY order, false for a SELL order", example = "true", required = true)
    private Boolean isBuyOrder;

    public BigInteger amountInValue() {
        return new BigInteger(amountIn);
    }

    public BigInteger amountOutValue() {
        return new BigInteger(amountOut);
    }
}
