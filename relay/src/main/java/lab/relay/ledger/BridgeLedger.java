package lab.relay.ledger;

import java.math.BigInteger;

/**
 * Fixed surface of the destination-chain bridge and wrapped-token contracts.
 *
 * <p>The ledger re-checks everything on its own: deposit bounds, the attestation signature against
 * its signer role, and replay of a deposit id. Rejections surface as {@link LedgerRevertException}
 * carrying the contract's revert reason; infrastructure failures surface as
 * {@link lab.relay.common.BridgeException} with {@code RPC_UNAVAILABLE}, in which case the outcome of
 * a submitted call is unknown and must be checked with {@link #isProcessed(String)} before any resubmission.
 */
public interface BridgeLedger {

    String REASON_INVALID_AMOUNT = "Invalid amount";
    String REASON_ALREADY_PROCESSED = "Deposit already processed";
    String REASON_INVALID_SIGNATURE = "Invalid signature";
    String REASON_AMOUNT_BELOW_FEE = "Amount must exceed fee";
    String REASON_INSUFFICIENT_BALANCE = "ERC20: burn amount exceeds balance";
    String REASON_TRANSFER_EXCEEDS_BALANCE = "ERC20: transfer amount exceeds balance";
    String REASON_PAUSED = "Pausable: paused";

    LedgerReceipt processDeposit(String destAddress, BigInteger amount, String depositId, String signature);

    // Debits amount from the requester; the bridge fee is retained and amount - fee is released for payout.
    LedgerReceipt requestWithdrawal(String requester, String destChainAddress, BigInteger amount);

    // Compensating credit for a withdrawal whose payout failed.
    LedgerReceipt refundWithdrawal(String requester, BigInteger amount);

    LedgerReceipt transfer(String from, String to, BigInteger amount);

    BigInteger balanceOf(String account);

    boolean isProcessed(String depositId);

    BigInteger bridgeFee();
}
