package defi.protocol.orderbook.enums;

/**
 * Counter-order selection policy used by the matching engine
 */
public enum MatchingPolicy {
    /**
     * First compatible candidate in insertion order, regardless of price
     */
    FIFO,

    /**
     * Most generous compatible candidate first, insertion order among equal prices
     */
    BEST_PRICE
}
