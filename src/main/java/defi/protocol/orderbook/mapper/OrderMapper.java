package defi.protocol.orderbook.mapper;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.enums.OrderSide;
import defi.protocol.orderbook.enums.OrderStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * MyBatis mapper interface for Order entity
 */
@Mapper
public interface OrderMapper {

    /**
     * Insert a new order, populating its generated sequence
     * @param order the order to insert
     * @return number of rows affected
     */
    int insert(Order order);

    /**
     * Move an order from one status to another.
     * Only status and updated_at are written; the row must currently hold expectedStatus.
     * @return number of rows affected (0 when the order is not in expectedStatus)
     */
    int updateStatus(@Param("orderId") String orderId,
                     @Param("expectedStatus") OrderStatus expectedStatus,
                     @Param("newStatus") OrderStatus newStatus,
                     @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * Find order by ID
     * @param orderId the order ID
     * @return the order, or null if not found
     */
    Order findById(@Param("orderId") String orderId);

    /**
     * Find every order of one side of a book, oldest first
     */
    List<Order> findByPairKeyAndSide(@Param("pairKey") String pairKey, @Param("side") OrderSide side);

    /**
     * Find all order IDs of a maker, oldest first
     */
    List<String> findOrderIdsByMaker(@Param("maker") String maker);

    /**
     * Find orders by status, oldest first
     */
    List<Order> findByStatus(@Param("status") OrderStatus status);

    /**
     * Highest logical creation time ever stored, or null when empty
     */
    Long findMaxCreationTime();

    /**
     * Find all orders (for testing)
     */
    List<Order> findAll();

    /**
     * Delete all orders (for testing)
     */
    int deleteAll();
}
