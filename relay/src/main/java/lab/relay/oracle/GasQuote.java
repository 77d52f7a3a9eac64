package lab.relay.oracle;

import java.math.BigInteger;
import java.time.Instant;

public record GasQuote(
        BigInteger price,
        Instant lastUpdatedAt,
        int feeMultiplier
) {

    // price * gasLimit * multiplier / 100, truncated like the contract's integer division
    public BigInteger feeFor(BigInteger gasLimit) {
        return price.multiply(gasLimit).multiply(BigInteger.valueOf(feeMultiplier)).divide(BigInteger.valueOf(100));
    }
}
