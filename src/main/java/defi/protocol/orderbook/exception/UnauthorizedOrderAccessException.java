package defi.protocol.orderbook.exception;

/**
 * Thrown when someone other than the maker tries to cancel an order
 */
public class UnauthorizedOrderAccessException extends BusinessException {
    public UnauthorizedOrderAccessException(String message) {
        super(message);
    }
}
