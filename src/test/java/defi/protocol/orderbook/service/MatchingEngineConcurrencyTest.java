package defi.protocol.orderbook.service;

import defi.protocol.orderbook.BaseIntegrationTest;
import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.domain.Trade;
import defi.protocol.orderbook.dto.MatchResult;
import defi.protocol.orderbook.enums.OrderSide;
import defi.protocol.orderbook.enums.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Concurrency tests for MatchingEngineService
 * Tests that per-book serialization never settles an order twice
 */
@DisplayName("Matching Engine Concurrency Tests")
class MatchingEngineConcurrencyTest extends BaseIntegrationTest {

    private static String account(int n) {
        return String.format("0x%040x", n);
    }

    @Test
    @DisplayName("Concurrent buys against resting sells - every order filled exactly once")
    void testConcurrentOrdersToSamePair() throws Exception {
        // GIVEN: 10 resting sells from distinct makers
        int numThreads = 10;
        for (int i = 0; i < numThreads; i++) {
            String seller = account(0x1000 + i);
            fund(seller, TOKEN_B, 100);
            submit(seller, OrderSide.SELL, TOKEN_B, 100, TOKEN_A, 100);
        }

        // WHEN: 10 concurrent buys
        List<Future<MatchResult>> futures = runConcurrently(numThreads, i -> {
            String buyer = account(0x2000 + i);
            fund(buyer, TOKEN_A, 100);
            return submit(buyer, OrderSide.BUY, TOKEN_A, 100, TOKEN_B, 100);
        });

        // THEN: every buy matched a distinct sell
        Set<String> counterOrders = new HashSet<>();
        for (Future<MatchResult> future : futures) {
            MatchResult result = future.get();
            assertThat(result.isMatched()).isTrue();
            assertThat(counterOrders.add(result.getCounterOrder().getOrderId())).isTrue();
        }

        assertThat(orderMapper.findAll()).allMatch(o -> o.getStatus() == OrderStatus.FILLED);
        List<Trade> trades = tradeMapper.findAll();
        assertThat(trades).hasSize(numThreads);
        assertThat(trades).extracting(Trade::getSellOrderId).doesNotHaveDuplicates();
        assertThat(orderBookIndex.getOrderBooks()).allMatch(book -> book.openOrderCount() == 0);
    }

    @Test
    @DisplayName("Concurrent buys racing for one sell - exactly one wins")
    void testRaceForSingleCounterOrder() throws Exception {
        fund(ALICE, TOKEN_B, 100);
        Order sell = submit(ALICE, OrderSide.SELL, TOKEN_B, 100, TOKEN_A, 100).getIncomingOrder();

        int numThreads = 5;
        List<Future<MatchResult>> futures = runConcurrently(numThreads, i -> {
            String buyer = account(0x3000 + i);
            fund(buyer, TOKEN_A, 100);
            return submit(buyer, OrderSide.BUY, TOKEN_A, 100, TOKEN_B, 100);
        });

        int matched = 0;
        for (Future<MatchResult> future : futures) {
            if (future.get().isMatched()) {
                matched++;
            }
        }

        assertThat(matched).isEqualTo(1);
        assertOrderStatus(sell, OrderStatus.FILLED);
        assertThat(tradeMapper.findAll()).hasSize(1);
        assertThat(balance(TOKEN_B, ALICE)).isEqualTo(BigInteger.ZERO);
        assertThat(balance(TOKEN_A, ALICE)).isEqualTo(BigInteger.valueOf(100));
    }

    @Test
    @DisplayName("Cancel racing a match - the loser fails, the order is never both")
    void testCancelRacingMatch() throws Exception {
        fund(ALICE, TOKEN_B, 100);
        fund(BOB, TOKEN_A, 100);
        Order sell = submit(ALICE, OrderSide.SELL, TOKEN_B, 100, TOKEN_A, 100).getIncomingOrder();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch startLatch = new CountDownLatch(1);
        Future<?> cancel = executor.submit(() -> {
            startLatch.await();
            return matchingEngineService.cancelOrder(sell.getOrderId(), ALICE);
        });
        Future<MatchResult> buy = executor.submit(() -> {
            startLatch.await();
            return submit(BOB, OrderSide.BUY, TOKEN_A, 100, TOKEN_B, 100);
        });
        startLatch.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        OrderStatus finalStatus = reload(sell).getStatus();
        if (finalStatus == OrderStatus.CANCELLED) {
            assertThat(buy.get().isMatched()).isFalse();
            assertThat(tradeMapper.findAll()).isEmpty();
        } else {
            assertThat(finalStatus).isEqualTo(OrderStatus.FILLED);
            assertThat(buy.get().isMatched()).isTrue();
            assertThatThrownBy(cancel::get).hasCauseInstanceOf(
                    defi.protocol.orderbook.exception.InvalidOrderStateException.class);
        }
    }

    private List<Future<MatchResult>> runConcurrently(int numThreads, IndexedTask task) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch completionLatch = new CountDownLatch(numThreads);
        List<Future<MatchResult>> futures = new ArrayList<>();

        for (int i = 0; i < numThreads; i++) {
            final int index = i;
            futures.add(executor.submit(() -> {
                try {
                    startLatch.await();
                    return task.run(index);
                } finally {
                    completionLatch.countDown();
                }
            }));
        }

        startLatch.countDown();
        assertThat(completionLatch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        return futures;
    }

    @FunctionalInterface
    private interface IndexedTask {
        MatchResult run(int index) throws Exception;
    }
}
