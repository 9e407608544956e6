package defi.protocol.orderbook.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Set the caller's allowance for the engine on one token
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ledger approval request")
public class ApprovalRequest {

    @NotBlank(message = "token cannot be blank")
    @Pattern(regexp = Patterns.ADDRESS, message = "token must be a 0x-prefixed 20-byte hex address")
    private String token;

    @NotBlank(message = "amount cannot be blank")
    @Pattern(regexp = Patterns.UINT, message = "amount must be an unsigned integer")
    @Schema(description = "Absolute allowance, replaces any previous one", example = "1000000")
    private String amount;
}
