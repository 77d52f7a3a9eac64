package lab.relay.common;

import org.springframework.http.HttpStatus;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum ErrorCode {
    INVALID_REQUEST(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST),
    INVALID_AMOUNT(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST),
    INVALID_ADDRESS(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST),
    INVALID_GAS_LIMIT(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST),
    INVALID_GAS_PRICE(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST),
    INVALID_MULTIPLIER(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST),

    INVALID_SIGNATURE(ErrorCategory.AUTHORIZATION, HttpStatus.FORBIDDEN),
    UNAUTHORIZED(ErrorCategory.AUTHORIZATION, HttpStatus.FORBIDDEN),
    UNAUTHENTICATED(ErrorCategory.AUTHORIZATION, HttpStatus.UNAUTHORIZED),

    NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND),

    CONFLICTING_DEPOSIT(ErrorCategory.STATE_CONFLICT, HttpStatus.CONFLICT),
    ALREADY_PROCESSED(ErrorCategory.STATE_CONFLICT, HttpStatus.CONFLICT),
    INSUFFICIENT_CONFIRMATIONS(ErrorCategory.STATE_CONFLICT, HttpStatus.CONFLICT),
    INSUFFICIENT_BALANCE(ErrorCategory.STATE_CONFLICT, HttpStatus.CONFLICT),
    INVALID_STATE(ErrorCategory.STATE_CONFLICT, HttpStatus.CONFLICT),
    DEPOSIT_EXPIRED(ErrorCategory.STATE_CONFLICT, HttpStatus.CONFLICT),
    SOURCE_TX_MISMATCH(ErrorCategory.STATE_CONFLICT, HttpStatus.CONFLICT),
    TOO_SOON(ErrorCategory.STATE_CONFLICT, HttpStatus.CONFLICT),

    DAILY_LIMIT_EXCEEDED(ErrorCategory.CIRCUIT_BREAKER, HttpStatus.TOO_MANY_REQUESTS),
    SUSPICIOUS_PRICE_MOVEMENT(ErrorCategory.CIRCUIT_BREAKER, HttpStatus.SERVICE_UNAVAILABLE),
    SYSTEM_PAUSED(ErrorCategory.CIRCUIT_BREAKER, HttpStatus.SERVICE_UNAVAILABLE),

    RPC_UNAVAILABLE(ErrorCategory.TRANSIENT_INFRA, HttpStatus.SERVICE_UNAVAILABLE),

    TRANSFER_FAILED(ErrorCategory.FATAL_INVARIANT, HttpStatus.INTERNAL_SERVER_ERROR),
    INVARIANT_VIOLATION(ErrorCategory.FATAL_INVARIANT, HttpStatus.INTERNAL_SERVER_ERROR);

    private final ErrorCategory category;
    private final HttpStatus httpStatus;

    ErrorCode(ErrorCategory category, HttpStatus httpStatus) {
        this.category = category;
        this.httpStatus = httpStatus;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    // Contract-style error identity, e.g. DAILY_LIMIT_EXCEEDED -> DailyLimitExceeded.
    public String identity() {
        return Arrays.stream(name().split("_"))
                .map(part -> part.charAt(0) + part.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining());
    }
}
