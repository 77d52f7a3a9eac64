package lab.relay.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

// Global pause switch consulted by every mutating entry point of the relay and the fee oracle.
@Component
@Slf4j
public class EmergencyStop {

    public static final String PAUSED_REASON = "Pausable: paused";

    private final AtomicBoolean paused = new AtomicBoolean(false);

    public boolean isPaused() {
        return paused.get();
    }

    public boolean pause() {
        boolean changed = paused.compareAndSet(false, true);
        log.warn("event=emergency_stop.pause changed={}", changed);
        return changed;
    }

    public boolean unpause() {
        boolean changed = paused.compareAndSet(true, false);
        log.warn("event=emergency_stop.unpause changed={}", changed);
        return changed;
    }

    public void ensureNotPaused(String operation) {
        if (paused.get()) {
            log.info("event=emergency_stop.rejected operation={}", operation);
            throw new BridgeException(ErrorCode.SYSTEM_PAUSED, PAUSED_REASON, Map.of("operation", operation));
        }
    }
}
