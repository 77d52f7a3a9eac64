package lab.relay.api;

import lab.relay.common.ApiResponse;
import lab.relay.common.CorrelationIdFilter;
import lab.relay.domain.withdrawal.Withdrawal;
import lab.relay.orchestration.BridgeRelay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/withdrawals")
@Slf4j
public class WithdrawalController {

    private final BridgeRelay bridgeRelay;

    // The caller account is the requester whose wrapped balance is debited.
    @PostMapping
    public ResponseEntity<ApiResponse<Withdrawal>> create(
            @RequestHeader(CorrelationIdFilter.ACCOUNT_HEADER) String requester,
            @RequestBody CreateWithdrawalRequest req
    ) {
        log.info(
                "event=withdrawal.create.request requester={} destChainAddress={} amount={}",
                requester,
                req.destChainAddress(),
                req.amount()
        );
        Withdrawal withdrawal = bridgeRelay.requestWithdrawal(requester, req.destChainAddress(), req.amount());
        log.info("event=withdrawal.create.response withdrawalId={} status={}", withdrawal.getId(), withdrawal.getStatus());
        return ResponseEntity.ok(ApiResponse.ok(withdrawal));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Withdrawal>> get(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.ok(bridgeRelay.getWithdrawal(id)));
    }

    // Reconciliation queue: debited on the ledger, payout not yet confirmed.
    @GetMapping("/locked")
    public ResponseEntity<ApiResponse<List<Withdrawal>>> locked() {
        return ResponseEntity.ok(ApiResponse.ok(bridgeRelay.listLockedWithdrawals()));
    }

    @PostMapping("/{id}/payout")
    public ResponseEntity<ApiResponse<Withdrawal>> confirmPayout(
            @RequestHeader(CorrelationIdFilter.ACCOUNT_HEADER) String operator,
            @PathVariable UUID id,
            @RequestBody PayoutRequest req
    ) {
        log.info("event=withdrawal.payout.request withdrawalId={} payoutTxId={}", id, req.payoutTxId());
        return ResponseEntity.ok(ApiResponse.ok(bridgeRelay.confirmPayout(operator, id, req.payoutTxId())));
    }

    @PostMapping("/{id}/refund")
    public ResponseEntity<ApiResponse<Withdrawal>> refund(
            @RequestHeader(CorrelationIdFilter.ACCOUNT_HEADER) String admin,
            @PathVariable UUID id,
            @RequestBody(required = false) RefundRequest req
    ) {
        String reason = req == null || req.reason() == null ? "payout failed" : req.reason();
        log.info("event=withdrawal.refund.request withdrawalId={} reason={}", id, reason);
        return ResponseEntity.ok(ApiResponse.ok(bridgeRelay.refundWithdrawal(admin, id, reason)));
    }
}
