package defi.protocol.orderbook.enums;

/**
 * Order side. A BUY order is matched only against SELL orders and vice versa.
 */
public enum OrderSide {
    /**
     * Maker wants to accumulate tokenOut, paying with tokenIn
     */
    BUY,

    /**
     * Maker wants to dispose of tokenIn in exchange for tokenOut
     */
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    public static OrderSide fromBuyFlag(boolean isBuyOrder) {
        return isBuyOrder ? BUY : SELL;
    }
}
