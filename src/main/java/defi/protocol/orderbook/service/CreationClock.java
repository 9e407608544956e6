package defi.protocol.orderbook.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Logical submission clock.
 * Follows wall-clock millis but never returns the same value twice, so order ids
 * derived from it cannot collide even for identical orders of one maker.
 */
@Slf4j
@Component
public class CreationClock {

    private final Clock clock;

    private long last;

    @Autowired
    public CreationClock(Clock clock) {
        this.clock = clock;
    }

    public synchronized long next() {
        long now = clock.millis();
        last = Math.max(now, last + 1);
        return last;
    }

    /**
     * Move the clock past a timestamp already in use (start-up recovery)
     */
    public synchronized void advancePast(long timestamp) {
        if (timestamp > last) {
            last = timestamp;
            log.info("Creation clock advanced to {}", timestamp);
        }
    }
}
