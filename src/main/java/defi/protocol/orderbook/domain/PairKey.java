package defi.protocol.orderbook.domain;

import lombok.Value;

/**
 * Canonical identifier of a token pair book.
 * token0 is always the numerically lower address, so (A,B) and (B,A) share one key.
 */
@Value
public class PairKey {
    /**
     * keccak256(token0 ++ token1) as 0x-prefixed hex
     */
    String key;

    String token0;

    String token1;

    @Override
    public String toString() {
        return key;
    }
}
