package lab.relay.api;

import lab.relay.common.ApiResponse;
import lab.relay.domain.deposit.Deposit;
import lab.relay.monitor.ChainMonitor;
import lab.relay.monitor.DepositInfo;
import lab.relay.orchestration.BridgeRelay;
import lab.relay.orchestration.ProcessingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/deposits")
@Slf4j
public class DepositController {

    private final ChainMonitor chainMonitor;
    private final BridgeRelay bridgeRelay;

    // Register a deposit observed on the source chain. Re-posting the same payload returns the existing record.
    @PostMapping
    public ResponseEntity<ApiResponse<Deposit>> register(@RequestBody RegisterDepositRequest req) {
        log.info(
                "event=deposit.register.request txId={} destAddress={} amount={}",
                req.txId(),
                req.destAddress(),
                req.amount()
        );
        Deposit deposit = chainMonitor.addDepositInfo(
                req.txId(),
                new DepositInfo(req.sourceAddress(), req.destAddress(), req.amount())
        );
        log.info("event=deposit.register.response depositId={} status={}", deposit.getId(), deposit.getStatus());
        return ResponseEntity.ok(ApiResponse.ok(deposit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Deposit>> get(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.ok(bridgeRelay.getDeposit(id)));
    }

    // Check confirmations for the source transaction and mint once it is deep enough.
    @PostMapping("/{txId}/process")
    public ResponseEntity<ApiResponse<ProcessingResult>> process(
            @PathVariable String txId,
            @RequestBody(required = false) ProcessDepositRequest req
    ) {
        log.info("event=deposit.process.request txId={} attestationSupplied={}", txId, req != null && req.attestationSignature() != null);
        ProcessingResult result = chainMonitor.processTransaction(txId, req == null ? null : req.attestationSignature());
        log.info("event=deposit.process.response txId={} success={} status={}", txId, result.success(), result.status());
        if (result.success()) {
            return ResponseEntity.ok(ApiResponse.ok(result));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("depositId", result.depositId());
        details.put("status", result.status().name());
        details.put("confirmations", result.confirmations());
        return ResponseEntity.status(result.errorCode().getHttpStatus())
                .body(ApiResponse.failure(result.errorCode().name(), result.error(), details));
    }
}
