package lab.relay.api;

import java.math.BigInteger;

public record CompensateRequest(
        String relayer,
        BigInteger gasUsed
) {}
