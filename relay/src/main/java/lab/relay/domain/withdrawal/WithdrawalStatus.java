package lab.relay.domain.withdrawal;

public enum WithdrawalStatus {
    REQUESTED,
    LOCKED,
    PAID,
    REFUNDED
}
