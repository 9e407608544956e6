package defi.protocol.orderbook.ledger;

import defi.protocol.orderbook.exception.InvalidAmountsException;
import defi.protocol.orderbook.exception.TransferFailureException;
import defi.protocol.orderbook.mapper.TokenLedgerMapper;
import defi.protocol.orderbook.service.TokenAddresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Token ledger kept in the engine's own database.
 * Debits and allowance spends are conditional updates, so a row can never go negative
 * even when two books settle against the same account at once.
 */
@Slf4j
@Service
public class DatabaseTokenLedger implements TokenLedger {

    @Autowired
    private TokenLedgerMapper ledgerMapper;

    @Value("${orderbook.engine-address}")
    private String engineAddress;

    @Override
    @Transactional
    public void transferFrom(String token, String owner, String recipient, BigInteger amount) {
        String normalizedToken = TokenAddresses.normalize(token, "token");
        String from = TokenAddresses.normalize(owner, "owner");
        String to = TokenAddresses.normalize(recipient, "recipient");
        requirePositive(amount);

        if (balanceOf(normalizedToken, to).add(amount).compareTo(MAX_AMOUNT) > 0) {
            log.warn("Transfer refused, recipient balance would overflow: token={}, recipient={}, amount={}",
                    normalizedToken, to, amount);
            throw new TransferFailureException(
                    "Recipient balance would overflow: token=" + normalizedToken + ", recipient=" + to);
        }

        LocalDateTime now = LocalDateTime.now();
        if (ledgerMapper.spendAllowance(normalizedToken, from, spender(), amount, now) == 0) {
            log.warn("Transfer refused, allowance too low: token={}, owner={}, amount={}",
                    normalizedToken, from, amount);
            throw new TransferFailureException(
                    "Insufficient allowance: token=" + normalizedToken + ", owner=" + from + ", amount=" + amount);
        }
        if (ledgerMapper.debitBalance(normalizedToken, from, amount, now) == 0) {
            log.warn("Transfer refused, balance too low: token={}, owner={}, amount={}",
                    normalizedToken, from, amount);
            throw new TransferFailureException(
                    "Insufficient balance: token=" + normalizedToken + ", owner=" + from + ", amount=" + amount);
        }
        try {
            ledgerMapper.creditBalance(normalizedToken, to, amount, now);
        } catch (DataIntegrityViolationException e) {
            // credited concurrently by another book past the column range
            throw new TransferFailureException(
                    "Recipient balance would overflow: token=" + normalizedToken + ", recipient=" + to, e);
        }

        log.debug("Transferred {} of {} from {} to {}", amount, normalizedToken, from, to);
    }

    @Override
    @Transactional
    public void deposit(String token, String account, BigInteger amount) {
        String normalizedToken = TokenAddresses.normalize(token, "token");
        String normalizedAccount = TokenAddresses.normalize(account, "account");
        requirePositive(amount);
        if (balanceOf(normalizedToken, normalizedAccount).add(amount).compareTo(MAX_AMOUNT) > 0) {
            throw new InvalidAmountsException("Deposit would exceed the maximum balance: account="
                    + normalizedAccount + ", amount=" + amount);
        }

        ledgerMapper.creditBalance(normalizedToken, normalizedAccount, amount, LocalDateTime.now());
        log.info("Deposit: token={}, account={}, amount={}", normalizedToken, normalizedAccount, amount);
    }

    @Override
    @Transactional
    public void approve(String token, String owner, BigInteger amount) {
        String normalizedToken = TokenAddresses.normalize(token, "token");
        String normalizedOwner = TokenAddresses.normalize(owner, "owner");
        if (amount == null || amount.signum() < 0) {
            throw new InvalidAmountsException("Allowance must not be negative: " + amount);
        }
        if (amount.compareTo(MAX_AMOUNT) > 0) {
            log.debug("Allowance {} capped to {}", amount, MAX_AMOUNT);
            amount = MAX_AMOUNT;
        }

        ledgerMapper.upsertAllowance(normalizedToken, normalizedOwner, spender(), amount, LocalDateTime.now());
        log.info("Approval: token={}, owner={}, spender={}, amount={}",
                normalizedToken, normalizedOwner, spender(), amount);
    }

    @Override
    public BigInteger balanceOf(String token, String account) {
        BigInteger balance = ledgerMapper.findBalance(
                TokenAddresses.normalize(token, "token"), TokenAddresses.normalize(account, "account"));
        return balance == null ? BigInteger.ZERO : balance;
    }

    @Override
    public BigInteger allowance(String token, String owner) {
        BigInteger allowance = ledgerMapper.findAllowance(
                TokenAddresses.normalize(token, "token"), TokenAddresses.normalize(owner, "owner"), spender());
        return allowance == null ? BigInteger.ZERO : allowance;
    }

    @Override
    public String spender() {
        return TokenAddresses.normalize(engineAddress, "engine");
    }

    private void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountsException("Transfer amount must be positive: " + amount);
        }
    }
}
