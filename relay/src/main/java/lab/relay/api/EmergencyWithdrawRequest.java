package lab.relay.api;

import java.math.BigInteger;

public record EmergencyWithdrawRequest(
        String to,
        BigInteger amount
) {}
