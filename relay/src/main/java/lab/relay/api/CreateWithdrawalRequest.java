package lab.relay.api;

import java.math.BigInteger;

public record CreateWithdrawalRequest(
        String destChainAddress,
        BigInteger amount
) {}
