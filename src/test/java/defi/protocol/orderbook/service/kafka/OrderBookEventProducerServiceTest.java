package defi.protocol.orderbook.service.kafka;

import defi.protocol.orderbook.domain.Order;
import defi.protocol.orderbook.event.OrderCancelledEvent;
import defi.protocol.orderbook.event.OrderCreatedEvent;
import defi.protocol.orderbook.event.OrderFilledEvent;
import defi.protocol.orderbook.testutil.OrderTestBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("Order Book Event Producer Tests")
class OrderBookEventProducerServiceTest {

    private KafkaTemplate<String, Object> kafkaTemplate;
    private OrderBookEventProducerService producerService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        producerService = new OrderBookEventProducerService();
        ReflectionTestUtils.setField(producerService, "orderBookKafkaTemplate", kafkaTemplate);
        ReflectionTestUtils.setField(producerService, "orderCreatedTopic", "orderbook.order-created");
        ReflectionTestUtils.setField(producerService, "orderFilledTopic", "orderbook.order-filled");
        ReflectionTestUtils.setField(producerService, "orderCancelledTopic", "orderbook.order-cancelled");
        ReflectionTestUtils.setField(producerService, "tradeExecutedTopic", "orderbook.trade-executed");
    }

    @Test
    @DisplayName("Events are sent to their topic keyed by pair key")
    void testEventsKeyedByPair() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(new CompletableFuture<SendResult<String, Object>>());
        Order order = OrderTestBuilder.buy().build();

        producerService.onOrderCreated(OrderCreatedEvent.fromOrder(order));
        producerService.onOrderFilled(OrderFilledEvent.fromOrder(order));
        producerService.onOrderCancelled(OrderCancelledEvent.fromOrder(order));

        verify(kafkaTemplate).send(eq("orderbook.order-created"), eq(order.getPairKey()), any(OrderCreatedEvent.class));
        verify(kafkaTemplate).send(eq("orderbook.order-filled"), eq(order.getPairKey()), any(OrderFilledEvent.class));
        verify(kafkaTemplate).send(eq("orderbook.order-cancelled"), eq(order.getPairKey()), any(OrderCancelledEvent.class));
    }

    @Test
    @DisplayName("A failed send completes exceptionally without throwing to the caller")
    void testFailedSendIsLogged() {
        CompletableFuture<SendResult<String, Object>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker unavailable"));
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(failed);

        Order order = OrderTestBuilder.sell().build();
        CompletableFuture<SendResult<String, Object>> result = producerService.publish(
                "orderbook.order-created", order.getPairKey(), OrderCreatedEvent.fromOrder(order), "test");

        assertThat(result).isCompletedExceptionally();
    }
}
