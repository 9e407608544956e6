package defi.protocol.orderbook.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Credit an account on the internal token ledger
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ledger deposit request")
public class DepositRequest {

    @NotBlank(message = "token cannot be blank")
    @Pattern(regexp = Patterns.ADDRESS, message = "token must be a 0x-prefixed 20-byte hex address")
    private String token;

    @NotBlank(message = "account cannot be blank")
    @Pattern(regexp = Patterns.ADDRESS, message = "account must be a 0x-prefixed 20-byte hex address")
    private String account;

    @NotBlank(message = "amount cannot be blank")
    @Pattern(regexp = Patterns.UINT, message = "amount must be an unsigned integer")
    @Schema(description = "Amount to credit", example = "1000000")
    private String amount;
}
