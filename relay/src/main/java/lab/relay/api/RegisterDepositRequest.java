package lab.relay.api;

import java.math.BigInteger;

public record RegisterDepositRequest(
        String txId,
        String sourceAddress,
        String destAddress,
        BigInteger amount
) {}
