package lab.relay.api;

public record RefundRequest(
        String reason
) {}
