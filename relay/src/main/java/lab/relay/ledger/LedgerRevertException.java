package lab.relay.ledger;

/**
 * The ledger refused the call. {@link #getReason()} is the contract revert text, kept verbatim
 * so it can be mapped onto domain error codes.
 */
public class LedgerRevertException extends RuntimeException {

    private final String reason;

    public LedgerRevertException(String reason) {
        super("ledger reverted: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
