package lab.relay.adapter;

import lab.relay.common.BridgeException;
import lab.relay.common.ErrorCode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

// Scriptable destination network for mock mode: gas price and outages are set by tests or /sim endpoints.
@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class SimulatedDestinationChain implements DestinationChain {

    private final long chainId;
    private final AtomicReference<BigInteger> gasPrice;
    private final AtomicInteger failuresRemaining = new AtomicInteger();

    public SimulatedDestinationChain(
            @Value("${relay.evm.chain-id:31337}") long chainId,
            @Value("${relay.fee-oracle.initial-gas-price:30000000000}") BigInteger initialGasPrice
    ) {
        this.chainId = chainId;
        this.gasPrice = new AtomicReference<>(initialGasPrice);
    }

    @Override
    public long chainId() {
        return chainId;
    }

    @Override
    public BigInteger gasPrice() {
        if (failuresRemaining.get() > 0 && failuresRemaining.getAndDecrement() > 0) {
            throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "simulated RPC timeout on eth_gasPrice");
        }
        return gasPrice.get();
    }

    public void setGasPrice(BigInteger price) {
        gasPrice.set(price);
    }

    // The next n gas price reads fail with a transient error.
    public void failNextReads(int n) {
        failuresRemaining.set(n);
    }
}
