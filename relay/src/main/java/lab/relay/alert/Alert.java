package lab.relay.alert;

// Webhook payload; timestamp is ISO-8601 UTC.
public record Alert(
        String title,
        String message,
        AlertSeverity severity,
        String environment,
        String timestamp
) {}
