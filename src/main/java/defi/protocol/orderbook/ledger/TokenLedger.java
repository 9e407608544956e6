package defi.protocol.orderbook.ledger;

import defi.protocol.orderbook.exception.TransferFailureException;

import java.math.BigInteger;

/**
 * Token balances with approval semantics.
 *
 * The engine only ever calls {@link #transferFrom}; it moves funds that the owner
 * has approved the engine to spend. Implementations must take part in the caller's
 * transaction so a later failure undoes an earlier transfer.
 */
public interface TokenLedger {

    /**
     * Largest balance, allowance or order amount the store can hold (DECIMAL(65,0))
     */
    BigInteger MAX_AMOUNT = BigInteger.TEN.pow(65).subtract(BigInteger.ONE);

    /**
     * Move amount of token from owner to recipient, spending the engine's allowance
     *
     * @throws TransferFailureException if the allowance or the balance does not cover the amount,
     *         or the recipient's balance would exceed {@link #MAX_AMOUNT}
     */
    void transferFrom(String token, String owner, String recipient, BigInteger amount);

    /**
     * Credit an account with newly minted funds
     *
     * @throws defi.protocol.orderbook.exception.InvalidAmountsException if the balance would exceed {@link #MAX_AMOUNT}
     */
    void deposit(String token, String account, BigInteger amount);

    /**
     * Set the amount of token the engine may move out of owner's balance.
     * Amounts above {@link #MAX_AMOUNT} are stored as {@link #MAX_AMOUNT}.
     */
    void approve(String token, String owner, BigInteger amount);

    BigInteger balanceOf(String token, String account);

    /**
     * Remaining amount the engine may spend on behalf of owner
     */
    BigInteger allowance(String token, String owner);

    /**
     * Account that owners approve; settlement transfers spend its allowance
     */
    String spender();
}
