package defi.protocol.orderbook.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Balance and engine allowance of one account on one token
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ledger balance")
public class LedgerBalanceResponse {

    private String token;

    private String account;

    private String balance;

    @Schema(description = "Amount the engine may still move out of the account")
    private String allowance;

    private String spender;
}
