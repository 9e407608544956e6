package defi.protocol.orderbook.exception;

/**
 * Thrown when the access gate refuses a state-changing operation
 */
public class OperationPausedException extends BusinessException {
    public OperationPausedException(String message) {
        super(message);
    }
}
