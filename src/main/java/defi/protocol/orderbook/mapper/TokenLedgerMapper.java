package defi.protocol.orderbook.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * MyBatis mapper for token balances and allowances
 */
@Mapper
public interface TokenLedgerMapper {

    BigInteger findBalance(@Param("token") String token, @Param("account") String account);

    BigInteger findAllowance(@Param("token") String token,
                             @Param("owner") String owner,
                             @Param("spender") String spender);

    /**
     * Subtract from a balance only if it covers the amount
     * @return number of rows affected (0 when the balance is insufficient or missing)
     */
    int debitBalance(@Param("token") String token,
                     @Param("account") String account,
                     @Param("amount") BigInteger amount,
                     @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * Add to a balance, creating the row when absent
     */
    int creditBalance(@Param("token") String token,
                      @Param("account") String account,
                      @Param("amount") BigInteger amount,
                      @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * Subtract from an allowance only if it covers the amount
     * @return number of rows affected (0 when the allowance is insufficient or missing)
     */
    int spendAllowance(@Param("token") String token,
                       @Param("owner") String owner,
                       @Param("spender") String spender,
                       @Param("amount") BigInteger amount,
                       @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * Set an allowance to an absolute value, creating the row when absent
     */
    int upsertAllowance(@Param("token") String token,
                        @Param("owner") String owner,
                        @Param("spender") String spender,
                        @Param("amount") BigInteger amount,
                        @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * Delete all balances and allowances (for testing)
     */
    int deleteAllBalances();

    int deleteAllAllowances();
}
