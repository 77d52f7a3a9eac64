package lab.relay.api;

public record FeeMultiplierRequest(
        int multiplier
) {}
