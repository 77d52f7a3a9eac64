package lab.relay.api;

public record PayoutRequest(
        String payoutTxId
) {}
