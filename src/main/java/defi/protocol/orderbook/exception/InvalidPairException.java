package defi.protocol.orderbook.exception;

/**
 * Thrown when tokenIn and tokenOut are the same token
 */
public class InvalidPairException extends InvalidOrderException {
    public InvalidPairException(String message) {
        super(message);
    }
}
