package defi.protocol.orderbook.strategy;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.OrderBook;
import defi.protocol.orderbook.domain.PairKey;
import defi.protocol.orderbook.testutil.OrderTestBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Best Price Matching Strategy Tests")
class BestPriceOrderMatchingStrategyTest {

    private static final String MAKER_1 = "0x0000000000000000000000000000000000000001";
    private static final String MAKER_2 = "0x0000000000000000000000000000000000000002";
    private static final String MAKER_3 = "0x0000000000000000000000000000000000000003";
    private static final String MAKER_4 = "0x0000000000000000000000000000000000000004";

    private final BestPriceOrderMatchingStrategy strategy = new BestPriceOrderMatchingStrategy();

    private OrderBook orderBook;

    @BeforeEach
    void setUp() {
        orderBook = new OrderBook(new PairKey("0xpair", OrderTestBuilder.TOKEN_X, OrderTestBuilder.TOKEN_Y));
    }

    @Test
    @DisplayName("Lowest ask wins over an older, worse ask")
    void testLowestAskWins() {
        orderBook.add(OrderTestBuilder.sell().maker(MAKER_2).amounts(800, 900).build());
        Order cheaper = OrderTestBuilder.sell().maker(MAKER_3).amounts(800, 500).build();
        orderBook.add(cheaper);

        Order incoming = OrderTestBuilder.buy().maker(MAKER_1).amounts(1000, 800).build();

        assertThat(strategy.selectCounterOrder(incoming, orderBook)).contains(cheaper);
    }

    @Test
    @DisplayName("Equal asks are taken in insertion order")
    void testEqualPriceTieBrokenByInsertion() {
        Order first = OrderTestBuilder.sell().maker(MAKER_2).amounts(800, 900).build();
        Order second = OrderTestBuilder.sell().maker(MAKER_3).amounts(1600, 1800).build();
        orderBook.add(second);
        orderBook.add(first);

        Order incoming = OrderTestBuilder.buy().maker(MAKER_1).amounts(1000, 800).build();

        assertThat(strategy.selectCounterOrder(incoming, orderBook)).contains(first);
    }

    @Test
    @DisplayName("Own best ask is skipped, next best is taken")
    void testSelfTradeSkipped() {
        orderBook.add(OrderTestBuilder.sell().maker(MAKER_1).amounts(800, 100).build());
        Order next = OrderTestBuilder.sell().maker(MAKER_4).amounts(800, 900).build();
        orderBook.add(next);

        Order incoming = OrderTestBuilder.buy().maker(MAKER_1).amounts(1000, 800).build();

        assertThat(strategy.selectCounterOrder(incoming, orderBook)).contains(next);
    }

    @Test
    @DisplayName("No match when the best ask is above the incoming limit")
    void testNoCompatibleAsk() {
        orderBook.add(OrderTestBuilder.sell().maker(MAKER_2).amounts(600, 700).build());

        Order incoming = OrderTestBuilder.buy().maker(MAKER_1).amounts(500, 600).build();

        assertThat(strategy.selectCounterOrder(incoming, orderBook)).isEmpty();
    }
}
