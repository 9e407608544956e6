package defi.protocol.orderbook.service;

import defi.protocol.orderbook.exception.InvalidOrderException;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Account and token address helpers. Addresses are handled as 0x-prefixed lower-case hex.
 */
public final class TokenAddresses {

    /**
     * Numeric order of addresses, as compared on-chain (uint160)
     */
    public static final Comparator<String> NUMERIC_ORDER =
            Comparator.comparing(TokenAddresses::toBigInteger);

    private static final Pattern HEX_ADDRESS = Pattern.compile("[0-9a-fA-F]{40}");

    private TokenAddresses() {
    }

    /**
     * Validate and normalize an address
     *
     * @param address the address, with or without 0x prefix, any case
     * @param field name used in the error message
     * @return normalized address
     * @throws InvalidOrderException if the address is not 20 bytes of hex
     */
    public static String normalize(String address, String field) {
        if (address == null) {
            throw new InvalidOrderException("Invalid " + field + " address: null");
        }
        String hex = Numeric.cleanHexPrefix(address.trim());
        if (!HEX_ADDRESS.matcher(hex).matches()) {
            throw new InvalidOrderException("Invalid " + field + " address: " + address);
        }
        return Numeric.prependHexPrefix(hex.toLowerCase());
    }

    public static BigInteger toBigInteger(String address) {
        return Numeric.toBigInt(address);
    }

    public static byte[] toBytes(String address) {
        return Numeric.toBytesPadded(toBigInteger(address), 20);
    }
}
