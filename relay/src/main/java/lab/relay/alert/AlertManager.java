package lab.relay.alert;

import lab.relay.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort operational alerts posted to a webhook.
 *
 * <p>Every send runs on the alert executor under its own timeout and completes with {@code true}
 * only when the webhook accepted the payload. Delivery failures are logged and turned into
 * {@code false}; nothing here throws into the caller, and callers on the critical path must not join.
 */
@Component
@Slf4j
public class AlertManager {

    public enum Comparison { ABOVE, BELOW }

    private final RestClient restClient;
    private final ExecutorService executor;
    private final Clock clock;
    private final String webhookUrl;
    private final String environment;
    private final Duration timeout;

    public AlertManager(
            @Qualifier("alertRestClient") RestClient restClient,
            @Qualifier("alertExecutor") ExecutorService executor,
            Clock clock,
            RelayProperties properties
    ) {
        this.restClient = restClient;
        this.executor = executor;
        this.clock = clock;
        this.webhookUrl = properties.getAlert().getWebhookUrl() == null ? "" : properties.getAlert().getWebhookUrl().trim();
        this.environment = properties.getEnvironment();
        this.timeout = properties.getAlert().getTimeout();
    }

    public CompletableFuture<Boolean> sendAlert(String title, String message, AlertSeverity severity) {
        Alert alert = new Alert(title, message, severity, environment, clock.instant().toString());
        if (webhookUrl.isEmpty()) {
            logOnly(alert);
            return CompletableFuture.completedFuture(false);
        }

        try {
            return CompletableFuture.supplyAsync(() -> deliver(alert), executor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(error -> {
                        log.warn("event=alert.delivery.failed title={} severity={} error={}", title, severity.wireName(), error.toString());
                        return false;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("event=alert.delivery.rejected title={} severity={} reason=executor_unavailable", title, severity.wireName());
            return CompletableFuture.completedFuture(false);
        }
    }

    public CompletableFuture<Boolean> sendMetricAlert(String metric, double value, double threshold, Comparison comparison) {
        boolean breached = comparison == Comparison.ABOVE ? value > threshold : value < threshold;
        if (!breached) {
            return CompletableFuture.completedFuture(false);
        }
        String direction = comparison == Comparison.ABOVE ? "above" : "below";
        return sendAlert(
                "Metric Alert: " + metric,
                metric + " is " + direction + " threshold: " + value + " (threshold: " + threshold + ")",
                AlertSeverity.WARNING
        );
    }

    public CompletableFuture<Boolean> sendHealthCheck(String service, boolean healthy, String details) {
        String status = healthy ? "healthy" : "unhealthy";
        String message = details == null || details.isBlank()
                ? service + " is " + status
                : service + " is " + status + ": " + details;
        return sendAlert("Health Check: " + service, message, healthy ? AlertSeverity.INFO : AlertSeverity.ERROR);
    }

    private boolean deliver(Alert alert) {
        restClient.post()
                .uri(webhookUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(alert)
                .retrieve()
                .toBodilessEntity();
        log.info("event=alert.delivery.sent title={} severity={}", alert.title(), alert.severity().wireName());
        return true;
    }

    private void logOnly(Alert alert) {
        switch (alert.severity()) {
            case CRITICAL, ERROR -> log.error("event=alert.logged title={} severity={} message={}", alert.title(), alert.severity().wireName(), alert.message());
            case WARNING -> log.warn("event=alert.logged title={} severity={} message={}", alert.title(), alert.severity().wireName(), alert.message());
            default -> log.info("event=alert.logged title={} severity={} message={}", alert.title(), alert.severity().wireName(), alert.message());
        }
    }
}
