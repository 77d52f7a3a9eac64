package lab.relay.ledger;

import java.math.BigInteger;

public record LedgerReceipt(
        String txHash,
        BigInteger amount
) {}
