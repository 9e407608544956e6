package defi.protocol.orderbook.enums;

/**
 * Order status enum representing the lifecycle of an order.
 * OPEN is the only non-terminal state.
 */
public enum OrderStatus {
    /**
     * Order is resting in the book waiting for a compatible counter-order
     */
    OPEN,

    /**
     * Order has been matched and settled in full
     */
    FILLED,

    /**
     * Order has been cancelled by its maker
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
