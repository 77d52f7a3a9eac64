package lab.relay.adapter;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Read-only source-chain data. Confirmation depth is the only finality signal the relay uses.
 */
public interface ChainDataProvider {

    Optional<ObservedTransaction> getTransaction(String txId);

    record ObservedTransaction(
            String txId,
            long confirmations,
            BigInteger amount,
            String senderAddress
    ) {}
}
