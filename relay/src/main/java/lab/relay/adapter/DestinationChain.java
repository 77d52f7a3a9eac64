package lab.relay.adapter;

import java.math.BigInteger;

/**
 * Read-only view of the destination network the fee oracle and health checks depend on.
 * Implementations throw {@link lab.relay.common.BridgeException} with {@code RPC_UNAVAILABLE}
 * on infrastructure failure so callers can apply the idempotent-read retry policy.
 */
public interface DestinationChain {

    long chainId();

    // Currently observed network gas price in wei.
    BigInteger gasPrice();
}
