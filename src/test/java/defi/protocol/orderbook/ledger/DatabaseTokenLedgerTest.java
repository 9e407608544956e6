package defi.protocol.orderbook.ledger;

import defi.protocol.orderbook.BaseIntegrationTest;
import defi.protocol.orderbook.exception.InvalidAmountsException;
import defi.protocol.orderbook.exception.TransferFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Database Token Ledger Tests")
class DatabaseTokenLedgerTest extends BaseIntegrationTest {

    @Test
    @DisplayName("transferFrom moves funds and spends the engine allowance")
    void testTransferFrom() {
        fund(ALICE, TOKEN_A, 1000);

        tokenLedger.transferFrom(TOKEN_A, ALICE, BOB, BigInteger.valueOf(400));

        assertThat(tokenLedger.balanceOf(TOKEN_A, ALICE)).isEqualTo(BigInteger.valueOf(600));
        assertThat(tokenLedger.balanceOf(TOKEN_A, BOB)).isEqualTo(BigInteger.valueOf(400));
        assertThat(tokenLedger.allowance(TOKEN_A, ALICE)).isEqualTo(BigInteger.valueOf(600));
    }

    @Test
    @DisplayName("transferFrom without allowance is refused")
    void testTransferWithoutAllowance() {
        tokenLedger.deposit(TOKEN_A, ALICE, BigInteger.valueOf(1000));

        assertThatThrownBy(() -> tokenLedger.transferFrom(TOKEN_A, ALICE, BOB, BigInteger.ONE))
                .isInstanceOf(TransferFailureException.class)
                .hasMessageContaining("allowance");
        assertThat(tokenLedger.balanceOf(TOKEN_A, ALICE)).isEqualTo(BigInteger.valueOf(1000));
    }

    @Test
    @DisplayName("transferFrom beyond the balance is refused and leaves the allowance untouched")
    void testTransferBeyondBalance() {
        tokenLedger.deposit(TOKEN_A, ALICE, BigInteger.valueOf(10));
        tokenLedger.approve(TOKEN_A, ALICE, BigInteger.valueOf(1000));

        assertThatThrownBy(() -> tokenLedger.transferFrom(TOKEN_A, ALICE, BOB, BigInteger.valueOf(11)))
                .isInstanceOf(TransferFailureException.class)
                .hasMessageContaining("balance");
        assertThat(tokenLedger.allowance(TOKEN_A, ALICE)).isEqualTo(BigInteger.valueOf(1000));
        assertThat(tokenLedger.balanceOf(TOKEN_A, BOB)).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("approve replaces the previous allowance, deposits accumulate")
    void testApproveAndDeposit() {
        tokenLedger.approve(TOKEN_A, ALICE, BigInteger.valueOf(5));
        tokenLedger.approve(TOKEN_A, ALICE, BigInteger.valueOf(3));
        tokenLedger.deposit(TOKEN_A, ALICE, BigInteger.valueOf(5));
        tokenLedger.deposit(TOKEN_A, ALICE, BigInteger.valueOf(7));

        assertThat(tokenLedger.allowance(TOKEN_A, ALICE)).isEqualTo(BigInteger.valueOf(3));
        assertThat(tokenLedger.balanceOf(TOKEN_A, ALICE)).isEqualTo(BigInteger.valueOf(12));
    }

    @Test
    @DisplayName("Non-positive amounts are rejected")
    void testInvalidAmounts() {
        assertThatThrownBy(() -> tokenLedger.deposit(TOKEN_A, ALICE, BigInteger.ZERO))
                .isInstanceOf(InvalidAmountsException.class);
        assertThatThrownBy(() -> tokenLedger.approve(TOKEN_A, ALICE, BigInteger.valueOf(-1)))
                .isInstanceOf(InvalidAmountsException.class);
    }

    @Test
    @DisplayName("Spender is the configured engine address")
    void testSpenderFromConfiguration() {
        assertThat(tokenLedger.spender()).isEqualTo("0x00000000000000000000000000000000000e6e1e");
    }

    @Test
    @DisplayName("Deposits past the maximum balance are rejected, the balance is kept")
    void testDepositBeyondMaximum() {
        tokenLedger.deposit(TOKEN_A, ALICE, TokenLedger.MAX_AMOUNT);

        assertThatThrownBy(() -> tokenLedger.deposit(TOKEN_A, ALICE, BigInteger.ONE))
                .isInstanceOf(InvalidAmountsException.class);
        assertThat(tokenLedger.balanceOf(TOKEN_A, ALICE)).isEqualTo(TokenLedger.MAX_AMOUNT);
    }

    @Test
    @DisplayName("transferFrom that would overflow the recipient is refused")
    void testTransferOverflowingRecipient() {
        tokenLedger.deposit(TOKEN_A, BOB, TokenLedger.MAX_AMOUNT);
        fund(ALICE, TOKEN_A, 10);

        assertThatThrownBy(() -> tokenLedger.transferFrom(TOKEN_A, ALICE, BOB, BigInteger.ONE))
                .isInstanceOf(TransferFailureException.class)
                .hasMessageContaining("overflow");
        assertThat(tokenLedger.balanceOf(TOKEN_A, ALICE)).isEqualTo(BigInteger.TEN);
        assertThat(tokenLedger.allowance(TOKEN_A, ALICE)).isEqualTo(BigInteger.TEN);
    }

    @Test
    @DisplayName("Unlimited approvals are stored as the maximum amount")
    void testUnlimitedApprovalCapped() {
        BigInteger uint256Max = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

        tokenLedger.approve(TOKEN_A, ALICE, uint256Max);

        assertThat(tokenLedger.allowance(TOKEN_A, ALICE)).isEqualTo(TokenLedger.MAX_AMOUNT);
    }
}
