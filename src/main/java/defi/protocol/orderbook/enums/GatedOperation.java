package defi.protocol.orderbook.enums;

/**
 * State-changing operations guarded by the access gate
 */
public enum GatedOperation {
    CREATE_ORDER,
    CANCEL_ORDER
}
