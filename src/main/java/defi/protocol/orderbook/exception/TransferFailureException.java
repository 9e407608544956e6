package defi.protocol.orderbook.exception;

/**
 * Thrown when the token ledger refuses a settlement transfer.
 * Rolls back the whole settlement, including the submission that triggered it.
 */
public class TransferFailureException extends BusinessException {
    public TransferFailureException(String message) {
        super(message);
    }

    public TransferFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
