package lab.relay.adapter;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

// Scriptable source chain for mock mode.
@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class InMemoryChainDataProvider implements ChainDataProvider {

    private final Map<String, ObservedTransaction> transactions = new ConcurrentHashMap<>();

    @Override
    public Optional<ObservedTransaction> getTransaction(String txId) {
        return Optional.ofNullable(transactions.get(txId));
    }

    public void record(String txId, BigInteger amount, String senderAddress, long confirmations) {
        transactions.put(txId, new ObservedTransaction(txId, confirmations, amount, senderAddress));
    }

    public void setConfirmations(String txId, long confirmations) {
        transactions.computeIfPresent(txId, (id, tx) ->
                new ObservedTransaction(id, confirmations, tx.amount(), tx.senderAddress()));
    }

    public void forget(String txId) {
        transactions.remove(txId);
    }
}
