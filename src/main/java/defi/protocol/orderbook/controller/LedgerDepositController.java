package defi.protocol.orderbook.controller;

import defi.protocol.orderbook.dto.ApiResponse;
import defi.protocol.orderbook.dto.DepositRequest;
import defi.protocol.orderbook.dto.LedgerBalanceResponse;
import defi.protocol.orderbook.ledger.TokenLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * Operator endpoint that mints ledger funds.
 * Only registered when orderbook.admin.enabled is true.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/ledger")
@ConditionalOnProperty(name = "orderbook.admin.enabled", havingValue = "true")
@Tag(name = "Token Ledger", description = "APIs for ledger balances and engine allowances")
public class LedgerDepositController {

    @Autowired
    private TokenLedger tokenLedger;

    @PostMapping("/deposits")
    @Operation(summary = "Deposit tokens", description = "Credit an account's balance")
    public ApiResponse<LedgerBalanceResponse> deposit(@Valid @RequestBody DepositRequest request) {
        log.info("Deposit request: token={}, account={}, amount={}",
                request.getToken(), request.getAccount(), request.getAmount());
        tokenLedger.deposit(request.getToken(), request.getAccount(), new BigInteger(request.getAmount()));
        return ApiResponse.success("Deposit recorded",
                TokenLedgerController.balance(tokenLedger, request.getToken(), request.getAccount()));
    }
}
