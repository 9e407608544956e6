package defi.protocol.orderbook.exception;

/**
 * Base class for business rule violations. Any of them aborts the whole operation.
 */
public class BusinessException extends RuntimeException {
    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
