package defi.protocol.orderbook.testutil;

import defi.protocol.orderbook.event.OrderCancelledEvent;
import defi.protocol.orderbook.event.OrderCreatedEvent;
import defi.protocol.orderbook.event.OrderFilledEvent;
import defi.protocol.orderbook.event.TradeExecutedEvent;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Records the events that reach after-commit listeners, the same way the Kafka forwarder sees them
 */
@Component
public class CommittedEventCollector {

    private final List<Object> events = new CopyOnWriteArrayList<>();

    @TransactionalEventListener
    public void onOrderCreated(OrderCreatedEvent event) {
        events.add(event);
    }

    @TransactionalEventListener
    public void onOrderFilled(OrderFilledEvent event) {
        events.add(event);
    }

    @TransactionalEventListener
    public void onOrderCancelled(OrderCancelledEvent event) {
        events.add(event);
    }

    @TransactionalEventListener
    public void onTradeExecuted(TradeExecutedEvent event) {
        events.add(event);
    }

    public <T> List<T> ofType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    public List<Object> all() {
        return List.copyOf(events);
    }

    public void clear() {
        events.clear();
    }
}
