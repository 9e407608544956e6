package defi.protocol.orderbook.service;

import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * Keccak-256 identifiers over tightly packed fields
 * (addresses as 20 bytes, integers as 32-byte big-endian words).
 */
@Component
public class OrderHashService {

    /**
     * Order id: keccak256(maker, tokenIn, tokenOut, amountIn, amountOut, creationTime)
     */
    public String orderId(String maker, String tokenIn, String tokenOut,
                          BigInteger amountIn, BigInteger amountOut, long creationTime) {
        ByteArrayOutputStream packed = new ByteArrayOutputStream(3 * 20 + 3 * 32);
        packed.writeBytes(TokenAddresses.toBytes(maker));
        packed.writeBytes(TokenAddresses.toBytes(tokenIn));
        packed.writeBytes(TokenAddresses.toBytes(tokenOut));
        packed.writeBytes(Numeric.toBytesPadded(amountIn, 32));
        packed.writeBytes(Numeric.toBytesPadded(amountOut, 32));
        packed.writeBytes(Numeric.toBytesPadded(BigInteger.valueOf(creationTime), 32));
        return Numeric.toHexString(Hash.sha3(packed.toByteArray()));
    }

    /**
     * Pair key: keccak256(token0, token1); callers pass the tokens already sorted
     */
    public String pairKey(String token0, String token1) {
        ByteArrayOutputStream packed = new ByteArrayOutputStream(40);
        packed.writeBytes(TokenAddresses.toBytes(token0));
        packed.writeBytes(TokenAddresses.toBytes(token1));
        return Numeric.toHexString(Hash.sha3(packed.toByteArray()));
    }
}
