package lab.relay.monitor;

import java.math.BigInteger;

public record DepositInfo(
        String sourceAddress,
        String destAddress,
        BigInteger amount
) {}
