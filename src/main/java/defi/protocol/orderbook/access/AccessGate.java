package defi.protocol.orderbook.access;

import defi.protocol.orderbook.enums.GatedOperation;
import defi.protocol.orderbook.exception.OperationPausedException;

/**
 * Decides whether a state-changing operation may run. Checked before any engine logic.
 */
public interface AccessGate {

    /**
     * @throws OperationPausedException if the operation is currently not permitted
     */
    void checkPermitted(GatedOperation operation);
}
