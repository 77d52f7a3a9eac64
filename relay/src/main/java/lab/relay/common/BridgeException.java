package lab.relay.common;

import java.math.BigInteger;
import java.util.Map;

/**
 * Single domain failure type. The {@link ErrorCode} is the stable machine-readable identity
 * surfaced to callers; the message keeps the contract revert text where one exists.
 */
public class BridgeException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    public BridgeException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public BridgeException(ErrorCode code, String message, Map<String, Object> details) {
        this(code, message, details, null);
    }

    public BridgeException(ErrorCode code, String message, Throwable cause) {
        this(code, message, Map.of(), cause);
    }

    public BridgeException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static BridgeException notFound(String kind, Object id) {
        return new BridgeException(ErrorCode.NOT_FOUND, kind + " not found: " + id, Map.of("id", String.valueOf(id)));
    }

    public static BridgeException insufficientBalance(BigInteger requested, BigInteger available) {
        return new BridgeException(
                ErrorCode.INSUFFICIENT_BALANCE,
                "InsufficientBalance(" + requested + ", " + available + ")",
                Map.of("requested", requested.toString(), "available", available.toString())
        );
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public boolean isRetryable() {
        return code.getCategory() == ErrorCategory.TRANSIENT_INFRA;
    }
}
