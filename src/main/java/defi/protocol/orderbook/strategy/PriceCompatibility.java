package defi.protocol.orderbook.strategy;

import defi.protocol.orderbook.domain.Order;

/**
 * Cross-multiplied price test between two mirroring orders.
 *
 * Each order offers amountIn of one token for at least amountOut of the other.
 * They can be swapped in full iff each side receives at least what it demands,
 * which without division reads {@code a.amountIn * b.amountIn >= a.amountOut * b.amountOut}.
 * The test is symmetric, so it does not matter which order is the buy side.
 */
public final class PriceCompatibility {

    private PriceCompatibility() {
    }

    public static boolean isCompatible(Order buy, Order sell) {
        return buy.getAmountIn().multiply(sell.getAmountIn())
                .compareTo(buy.getAmountOut().multiply(sell.getAmountOut())) >= 0;
    }

    /**
     * Whether candidate can be matched against incoming at all:
     * OPEN, another maker, opposite direction of the same pair
     */
    static boolean isEligible(Order incoming, Order candidate) {
        return candidate.isOpen()
                && !candidate.getMaker().equals(incoming.getMaker())
                && candidate.mirrors(incoming);
    }
}
