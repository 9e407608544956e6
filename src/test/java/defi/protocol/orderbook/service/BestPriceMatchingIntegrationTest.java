package defi.protocol.orderbook.service;

import defi.protocol.orderbook.BaseIntegrationTest;
import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.dto.MatchResult;
import defi.protocol.orderbook.enums.MatchingPolicy;
import defi.protocol.orderbook.enums.OrderSide;
import defi.protocol.orderbook.enums.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.context.TestPropertySource;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Best Price Matching Integration Tests")
@TestPropertySource(properties = "orderbook.matching.policy=BEST_PRICE")
class BestPriceMatchingIntegrationTest extends BaseIntegrationTest {

    @Test
    @DisplayName("BEST_PRICE policy settles against the most generous ask")
    void testMostGenerousAskWins() {
        assertThat(matchingEngineService.getMatchingPolicy()).isEqualTo(MatchingPolicy.BEST_PRICE);

        fund(ALICE, TOKEN_B, 800);
        fund(CAROL, TOKEN_B, 800);
        fund(BOB, TOKEN_A, 1000);

        Order olderAsk = submit(ALICE, OrderSide.SELL, TOKEN_B, 800, TOKEN_A, 900).getIncomingOrder();
        Order cheaperAsk = submit(CAROL, OrderSide.SELL, TOKEN_B, 800, TOKEN_A, 500).getIncomingOrder();

        MatchResult result = submit(BOB, OrderSide.BUY, TOKEN_A, 1000, TOKEN_B, 800);

        assertThat(result.getCounterOrder().getOrderId()).isEqualTo(cheaperAsk.getOrderId());
        assertOrderStatus(cheaperAsk, OrderStatus.FILLED);
        assertOrderStatus(olderAsk, OrderStatus.OPEN);
        // full-fill swap: the buyer still delivers its whole amountIn
        assertThat(balance(TOKEN_A, CAROL)).isEqualTo(BigInteger.valueOf(1000));
        // 500 * 1e18 / 800
        assertThat(result.getTrade().getExecutionPrice()).isEqualTo(new BigInteger("625000000000000000"));
    }
}
