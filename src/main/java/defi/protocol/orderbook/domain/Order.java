package defi.protocol.orderbook.domain;

import defi.protocol.orderbook.enums.OrderSide;
import defi.protocol.orderbook.enums.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Order entity representing a standing instruction to swap tokenIn for tokenOut.
 * Only status and updatedAt change after the order is stored.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    /**
     * Unique order identifier (bytes32 hex)
     */
    private String orderId;

    /**
     * Storage insertion number, used for FIFO ordering inside a book
     */
    private Long sequence;

    /**
     * Account that owns the order
     */
    private String maker;

    /**
     * Token the maker offers
     */
    private String tokenIn;

    /**
     * Token the maker demands in return
     */
    private String tokenOut;

    /**
     * Quantity of tokenIn offered
     */
    private BigInteger amountIn;

    /**
     * Minimum quantity of tokenOut demanded
     */
    private BigInteger amountOut;

    /**
     * Order side - BUY or SELL
     */
    private OrderSide side;

    /**
     * Canonical key of the book the order belongs to
     */
    private String pairKey;

    /**
     * Current status of the order
     */
    private OrderStatus status;

    /**
     * Logical submission timestamp (epoch millis, strictly increasing)
     */
    private Long creationTime;

    /**
     * Timestamp when order was created
     */
    private LocalDateTime createdAt;

    /**
     * Timestamp when order was last updated
     */
    private LocalDateTime updatedAt;

    @com.fasterxml.jackson.annotation.JsonIgnore
    public boolean isOpen() {
        return status == OrderStatus.OPEN;
    }

    /**
     * Check whether the other order trades the same pair in the opposite direction
     */
    @com.fasterxml.jackson.annotation.JsonIgnore
    public boolean mirrors(Order other) {
        return tokenIn.equals(other.getTokenOut()) && tokenOut.equals(other.getTokenIn());
    }
}
