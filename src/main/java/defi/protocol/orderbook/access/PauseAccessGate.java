package defi.protocol.orderbook.access;

import defi.protocol.orderbook.enums.GatedOperation;
import defi.protocol.orderbook.exception.OperationPausedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global pause switch. Queries stay available while paused.
 */
@Slf4j
@Component
public class PauseAccessGate implements AccessGate {

    private final AtomicBoolean paused;

    public PauseAccessGate(@Value("${orderbook.access.paused:false}") boolean initiallyPaused) {
        this.paused = new AtomicBoolean(initiallyPaused);
        if (initiallyPaused) {
            log.warn("Order book starts paused");
        }
    }

    @Override
    public void checkPermitted(GatedOperation operation) {
        if (paused.get()) {
            log.warn("Rejected {}: order book is paused", operation);
            throw new OperationPausedException("Order book is paused, " + operation + " not permitted");
        }
    }

    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.warn("Order book paused");
        }
    }

    public void unpause() {
        if (paused.compareAndSet(true, false)) {
            log.info("Order book unpaused");
        }
    }

    public boolean isPaused() {
        return paused.get();
    }
}
