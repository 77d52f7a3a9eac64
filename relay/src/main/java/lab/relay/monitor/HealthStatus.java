package lab.relay.monitor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record HealthStatus(
        Status status,
        Map<String, Check> checks,
        List<String> failingChecks,
        List<HealthRecord.ErrorEntry> errors,
        Instant timestamp
) {

    public enum Status { HEALTHY, UNHEALTHY }

    public record Check(boolean ok, String detail) {}

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }
}
