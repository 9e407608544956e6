package defi.protocol.orderbook.exception;

/**
 * Thrown when amountIn or amountOut is not strictly positive
 */
public class InvalidAmountsException extends InvalidOrderException {
    public InvalidAmountsException(String message) {
        super(message);
    }
}
