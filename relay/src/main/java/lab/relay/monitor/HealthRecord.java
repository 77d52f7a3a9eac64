package lab.relay.monitor;

import lab.relay.alert.Alert;
import lab.relay.alert.AlertSeverity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded ring of recent errors plus the last raised alert. Readers never block writers;
 * a snapshot may briefly hold one entry over capacity while an append is trimming.
 */
public class HealthRecord {

    public record ErrorEntry(
            Instant timestamp,
            String type,
            String message,
            AlertSeverity severity
    ) {}

    private final int capacity;
    private final ConcurrentLinkedDeque<ErrorEntry> errors = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final AtomicReference<Alert> lastAlert = new AtomicReference<>();

    public HealthRecord(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void append(ErrorEntry entry) {
        errors.addLast(entry);
        if (size.incrementAndGet() > capacity) {
            if (errors.pollFirst() != null) {
                size.decrementAndGet();
            }
        }
    }

    // Oldest first.
    public List<ErrorEntry> snapshot() {
        return new ArrayList<>(errors);
    }

    public long countSince(Instant since) {
        return errors.stream().filter(e -> !e.timestamp().isBefore(since)).count();
    }

    public void setLastAlert(Alert alert) {
        lastAlert.set(alert);
    }

    public Optional<Alert> getLastAlert() {
        return Optional.ofNullable(lastAlert.get());
    }

    public int capacity() {
        return capacity;
    }
}
