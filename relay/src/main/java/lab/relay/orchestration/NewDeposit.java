package lab.relay.orchestration;

import java.math.BigInteger;

// A deposit observed on the source chain, before it has an id.
public record NewDeposit(
        String sourceTxId,
        String sourceAddress,
        String destAddress,
        BigInteger amount
) {}
