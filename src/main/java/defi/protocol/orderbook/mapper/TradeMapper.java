package defi.protocol.orderbook.mapper;

import defi.protocol.orderbook.domain.Trade;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper interface for Trade entity
 */
@Mapper
public interface TradeMapper {

    /**
     * Insert a new trade
     * @param trade the trade to insert
     * @return number of rows affected
     */
    int insert(Trade trade);

    /**
     * Find all trades an order took part in (as buy or sell order)
     */
    List<Trade> findByOrderId(@Param("orderId") String orderId);

    /**
     * Find all trades (for testing)
     */
    List<Trade> findAll();

    /**
     * Delete all trades (for testing)
     */
    int deleteAll();
}
