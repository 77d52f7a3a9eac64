package lab.relay.orchestration;

import com.fasterxml.jackson.annotation.JsonInclude;
import lab.relay.common.BridgeException;
import lab.relay.common.ErrorCode;
import lab.relay.domain.deposit.Deposit;
import lab.relay.domain.deposit.DepositStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingResult(
        boolean success,
        String depositId,
        DepositStatus status,
        long confirmations,
        String txHash,
        ErrorCode errorCode,
        String error
) {

    public static final String INSUFFICIENT_CONFIRMATIONS = "Insufficient confirmations";

    public static ProcessingResult completed(Deposit deposit) {
        return new ProcessingResult(
                true,
                deposit.getId(),
                deposit.getStatus(),
                deposit.getConfirmations(),
                deposit.getMintTxHash(),
                null,
                null
        );
    }

    public static ProcessingResult insufficientConfirmations(Deposit deposit) {
        return new ProcessingResult(
                false,
                deposit.getId(),
                deposit.getStatus(),
                deposit.getConfirmations(),
                null,
                ErrorCode.INSUFFICIENT_CONFIRMATIONS,
                INSUFFICIENT_CONFIRMATIONS
        );
    }

    public static ProcessingResult failed(String depositId, DepositStatus status, long confirmations, BridgeException error) {
        return new ProcessingResult(false, depositId, status, confirmations, null, error.getCode(), error.getMessage());
    }
}
