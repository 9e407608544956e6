package defi.protocol.orderbook.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Open orders of one side of a book.
 *
 * Keeps two views over the same orders: insertion order for FIFO selection,
 * and price-time order grouped by offered token for best-price selection.
 * Both support O(log n) insert and removal.
 */
public class BookSide {

    private final ConcurrentSkipListMap<Long, Order> bySequence = new ConcurrentSkipListMap<>();

    private final Map<String, ConcurrentSkipListMap<PriceTimeKey, Order>> byPrice = new ConcurrentHashMap<>();

    public void add(Order order) {
        bySequence.put(order.getSequence(), order);
        byPrice.computeIfAbsent(order.getTokenIn(), k -> new ConcurrentSkipListMap<>())
                .put(PriceTimeKey.of(order), order);
    }

    /**
     * Remove an order from both views
     *
     * @return true if the order was present
     */
    public boolean remove(Order order) {
        Order removed = bySequence.remove(order.getSequence());
        if (removed == null) {
            return false;
        }
        ConcurrentSkipListMap<PriceTimeKey, Order> level = byPrice.get(removed.getTokenIn());
        if (level != null) {
            level.remove(PriceTimeKey.of(removed));
            if (level.isEmpty()) {
                byPrice.remove(removed.getTokenIn());
            }
        }
        return true;
    }

    public boolean contains(Order order) {
        return bySequence.containsKey(order.getSequence());
    }

    /**
     * Open orders, oldest first
     */
    public Collection<Order> inInsertionOrder() {
        return bySequence.values();
    }

    /**
     * Open orders offering the given token, most generous first
     */
    public Collection<Order> byPriceOffering(String tokenIn) {
        ConcurrentSkipListMap<PriceTimeKey, Order> level = byPrice.get(tokenIn);
        return level == null ? Collections.emptyList() : level.values();
    }

    public int size() {
        return bySequence.size();
    }

    public boolean isEmpty() {
        return bySequence.isEmpty();
    }

    public void clear() {
        bySequence.clear();
        byPrice.clear();
    }
}
