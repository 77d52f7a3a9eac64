package lab.relay.common;

/**
 * Failure taxonomy shared by every component. Only {@link #TRANSIENT_INFRA} is retried locally,
 * and only for idempotent reads.
 */
public enum ErrorCategory {
    VALIDATION,
    AUTHORIZATION,
    NOT_FOUND,
    STATE_CONFLICT,
    CIRCUIT_BREAKER,
    TRANSIENT_INFRA,
    FATAL_INVARIANT
}
