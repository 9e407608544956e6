package defi.protocol.orderbook.service.kafka;

import defi.protocol.orderbook.event.OrderCancelledEvent;
import defi.protocol.orderbook.event.OrderCreatedEvent;
import defi.protocol.orderbook.event.OrderFilledEvent;
import defi.protocol.orderbook.event.TradeExecutedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.CompletableFuture;

/**
 * Forwards committed order book events to Kafka.
 * Partition key = pair key, so every event of one book lands on one partition in commit order.
 * Events of rolled-back operations never reach this listener.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "kafka.events.enabled", havingValue = "true")
public class OrderBookEventProducerService {

    @Autowired
    private KafkaTemplate<String, Object> orderBookKafkaTemplate;

    @Value("${kafka.topics.order-created}")
    private String orderCreatedTopic;

    @Value("${kafka.topics.order-filled}")
    private String orderFilledTopic;

    @Value("${kafka.topics.order-cancelled}")
    private String orderCancelledTopic;

    @Value("${kafka.topics.trade-executed}")
    private String tradeExecutedTopic;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderCreated(OrderCreatedEvent event) {
        publish(orderCreatedTopic, event.getPairKey(), event, "orderId=" + event.getOrderId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderFilled(OrderFilledEvent event) {
        publish(orderFilledTopic, event.getPairKey(), event, "orderId=" + event.getOrderId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderCancelled(OrderCancelledEvent event) {
        publish(orderCancelledTopic, event.getPairKey(), event, "orderId=" + event.getOrderId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTradeExecuted(TradeExecutedEvent event) {
        publish(tradeExecutedTopic, event.getPairKey(), event, "tradeId=" + event.getTradeId());
    }

    /**
     * Send asynchronously; a failed send is logged, the committed state is not affected
     */
    CompletableFuture<SendResult<String, Object>> publish(String topic, String partitionKey,
                                                         Object event, String description) {
        log.debug("Publishing {} to {}: {}", event.getClass().getSimpleName(), topic, description);

        CompletableFuture<SendResult<String, Object>> future =
                orderBookKafkaTemplate.send(topic, partitionKey, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published: topic={}, {}, partition={}, offset={}",
                        topic, description,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event: topic={}, {}, error={}",
                        topic, description, ex.getMessage(), ex);
            }
        });

        return future;
    }
}
