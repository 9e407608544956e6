package defi.protocol.orderbook.exception;

/**
 * Thrown when an operation requires an OPEN order but the order is already terminal
 */
public class InvalidOrderStateException extends BusinessException {
    public InvalidOrderStateException(String message) {
        super(message);
    }
}
