package lab.relay.domain.deposit;

public enum DepositStatus {
    PENDING,
    CONFIRMED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
