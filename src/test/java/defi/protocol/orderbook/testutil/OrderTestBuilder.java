package defi.protocol.orderbook.testutil;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.enums.OrderSide;
import defi.protocol.orderbook.enums.OrderStatus;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fluent builder for in-memory test orders
 * Provides sensible defaults for testing; each build gets the next sequence number
 */
public class OrderTestBuilder {

    public static final String TOKEN_X = "0x1111111111111111111111111111111111111111";
    public static final String TOKEN_Y = "0x2222222222222222222222222222222222222222";

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private String maker = "0x0000000000000000000000000000000000000001";
    private OrderSide side = OrderSide.BUY;
    private String tokenIn = TOKEN_X;
    private String tokenOut = TOKEN_Y;
    private BigInteger amountIn = BigInteger.valueOf(1000);
    private BigInteger amountOut = BigInteger.valueOf(800);
    private OrderStatus status = OrderStatus.OPEN;
    private Long sequence;

    /**
     * BUY order offering X for Y
     */
    public static OrderTestBuilder buy() {
        return new OrderTestBuilder();
    }

    /**
     * SELL order offering Y for X
     */
    public static OrderTestBuilder sell() {
        return new OrderTestBuilder().side(OrderSide.SELL).tokens(TOKEN_Y, TOKEN_X);
    }

    public OrderTestBuilder maker(String maker) {
        this.maker = maker;
        return this;
    }

    public OrderTestBuilder side(OrderSide side) {
        this.side = side;
        return this;
    }

    public OrderTestBuilder tokens(String tokenIn, String tokenOut) {
        this.tokenIn = tokenIn;
        this.tokenOut = tokenOut;
        return this;
    }

    public OrderTestBuilder amounts(long amountIn, long amountOut) {
        this.amountIn = BigInteger.valueOf(amountIn);
        this.amountOut = BigInteger.valueOf(amountOut);
        return this;
    }

    public OrderTestBuilder status(OrderStatus status) {
        this.status = status;
        return this;
    }

    public OrderTestBuilder sequence(long sequence) {
        this.sequence = sequence;
        return this;
    }

    public Order build() {
        long seq = sequence != null ? sequence : SEQUENCE.incrementAndGet();
        return Order.builder()
                .orderId("0x" + String.format("%064x", seq))
                .sequence(seq)
                .maker(maker)
                .side(side)
                .tokenIn(tokenIn)
                .tokenOut(tokenOut)
                .amountIn(amountIn)
                .amountOut(amountOut)
                .pairKey("0xpair")
                .status(status)
                .creationTime(seq)
                .build();
    }
}
