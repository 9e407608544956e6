package defi.protocol.orderbook.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigInteger;

/**
 * Sort key for resting orders: implied price first, insertion sequence second.
 *
 * The price is the quantity demanded per unit offered (amountOut / amountIn),
 * compared by cross-multiplication. A lower ratio is a more generous order on
 * either side of the book, so ascending order walks the best counter-orders first.
 */
@Getter
@EqualsAndHashCode
public final class PriceTimeKey implements Comparable<PriceTimeKey> {

    private final BigInteger amountOut;
    private final BigInteger amountIn;
    private final long sequence;

    private PriceTimeKey(BigInteger amountOut, BigInteger amountIn, long sequence) {
        this.amountOut = amountOut;
        this.amountIn = amountIn;
        this.sequence = sequence;
    }

    public static PriceTimeKey of(Order order) {
        return new PriceTimeKey(order.getAmountOut(), order.getAmountIn(), order.getSequence());
    }

    @Override
    public int compareTo(PriceTimeKey other) {
        int byPrice = amountOut.multiply(other.amountIn)
                .compareTo(other.amountOut.multiply(amountIn));
        if (byPrice != 0) {
            return byPrice;
        }
        return Long.compare(sequence, other.sequence);
    }
}
