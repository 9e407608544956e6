package defi.protocol.orderbook.controller;

import defi.protocol.orderbook.dto.ApiResponse;
import defi.protocol.orderbook.dto.ApprovalRequest;
import defi.protocol.orderbook.dto.LedgerBalanceResponse;
import defi.protocol.orderbook.ledger.TokenLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * REST Controller for the internal token ledger
 * Handles approvals and balance queries
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/ledger")
@Validated
@Tag(name = "Token Ledger", description = "APIs for ledger balances and engine allowances")
public class TokenLedgerController {

    @Autowired
    private TokenLedger tokenLedger;

    @PostMapping("/approvals")
    @Operation(summary = "Approve the engine",
               description = "Set how much of a token the engine may move out of the caller's balance at settlement")
    public ApiResponse<LedgerBalanceResponse> approve(
            @Parameter(description = "Owner account address", required = true)
            @RequestHeader(OrderController.ACCOUNT_HEADER) @NotBlank String caller,
            @Valid @RequestBody ApprovalRequest request) {
        log.info("Approval request: token={}, owner={}, amount={}", request.getToken(), caller, request.getAmount());
        tokenLedger.approve(request.getToken(), caller, new BigInteger(request.getAmount()));
        return ApiResponse.success("Approval recorded", balance(tokenLedger, request.getToken(), caller));
    }

    @GetMapping("/{token}/{account}")
    @Operation(summary = "Get balance", description = "Balance and engine allowance of an account on a token")
    public ApiResponse<LedgerBalanceResponse> getBalance(
            @PathVariable @NotBlank String token,
            @PathVariable @NotBlank String account) {
        return ApiResponse.success(balance(tokenLedger, token, account));
    }

    static LedgerBalanceResponse balance(TokenLedger tokenLedger, String token, String account) {
        return LedgerBalanceResponse.builder()
                .token(token.toLowerCase())
                .account(account.toLowerCase())
                .balance(tokenLedger.balanceOf(token, account).toString())
                .allowance(tokenLedger.allowance(token, account).toString())
                .spender(tokenLedger.spender())
                .build();
    }
}
