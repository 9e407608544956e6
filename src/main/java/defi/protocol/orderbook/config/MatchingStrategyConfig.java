package defi.protocol.orderbook.config;

import defi.protocol.orderbook.enums.MatchingPolicy;
import defi.protocol.orderbook.strategy.BestPriceOrderMatchingStrategy;
import defi.protocol.orderbook.strategy.FifoOrderMatchingStrategy;
import defi.protocol.orderbook.strategy.OrderMatchingStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Map;

/**
 * Configuration for order matching strategies and the engine clock
 */
@Configuration
public class MatchingStrategyConfig {

    /**
     * Map of MatchingPolicy to OrderMatchingStrategy.
     * MatchingEngineService picks the entry named by orderbook.matching.policy.
     *
     * @param fifoStrategy first compatible counter-order in insertion order
     * @param bestPriceStrategy most generous compatible counter-order
     * @return map of policy to strategy
     */
    @Bean
    public Map<MatchingPolicy, OrderMatchingStrategy> matchingStrategies(
            FifoOrderMatchingStrategy fifoStrategy,
            BestPriceOrderMatchingStrategy bestPriceStrategy) {
        return Map.of(
                MatchingPolicy.FIFO, fifoStrategy,
                MatchingPolicy.BEST_PRICE, bestPriceStrategy
        );
    }

    /**
     * Wall clock behind order creation times
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
