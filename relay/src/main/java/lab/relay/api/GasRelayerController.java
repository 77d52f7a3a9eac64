package lab.relay.api;

import lab.relay.common.ApiResponse;
import lab.relay.common.CorrelationIdFilter;
import lab.relay.domain.oracle.RelayerAccount;
import lab.relay.oracle.FeeOracle;
import lab.relay.oracle.GasQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/gas-relayer")
@Slf4j
public class GasRelayerController {

    private final FeeOracle feeOracle;

    @GetMapping("/estimate")
    public ResponseEntity<ApiResponse<Map<String, Object>>> estimate(@RequestParam BigInteger gasLimit) {
        BigInteger fee = feeOracle.estimateFee(gasLimit);
        GasQuote quote = feeOracle.getQuote();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("gasLimit", gasLimit);
        data.put("gasPrice", quote.price());
        data.put("feeMultiplier", quote.feeMultiplier());
        data.put("estimatedFee", fee);
        return ResponseEntity.ok(ApiResponse.ok(data));
    }

    @GetMapping("/quote")
    public ResponseEntity<ApiResponse<GasQuote>> quote() {
        return ResponseEntity.ok(ApiResponse.ok(feeOracle.getQuote()));
    }

    @GetMapping("/balance")
    public ResponseEntity<ApiResponse<Map<String, Object>>> balance(@RequestParam String relayer) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("relayer", relayer);
        data.put("balance", feeOracle.getRelayerBalance(relayer));
        data.put("dailyCompensated", feeOracle.getRelayerAccount(relayer)
                .map(RelayerAccount::getDailyCompensated)
                .orElse(BigInteger.ZERO));
        return ResponseEntity.ok(ApiResponse.ok(data));
    }

    @PostMapping("/compensate")
    public ResponseEntity<ApiResponse<Map<String, Object>>> compensate(
            @RequestHeader(CorrelationIdFilter.ACCOUNT_HEADER) String caller,
            @RequestBody CompensateRequest req
    ) {
        log.info("event=gas_relayer.compensate.request relayer={} gasUsed={}", req.relayer(), req.gasUsed());
        BigInteger compensation = feeOracle.compensateRelayer(caller, req.relayer(), req.gasUsed());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("relayer", req.relayer());
        data.put("compensation", compensation);
        data.put("balance", feeOracle.getRelayerBalance(req.relayer()));
        return ResponseEntity.ok(ApiResponse.ok(data));
    }

    // The caller withdraws its own accrued balance.
    @PostMapping("/withdraw")
    public ResponseEntity<ApiResponse<Map<String, Object>>> withdraw(
            @RequestHeader(CorrelationIdFilter.ACCOUNT_HEADER) String relayer
    ) {
        log.info("event=gas_relayer.withdraw.request relayer={}", relayer);
        BigInteger amount = feeOracle.withdrawBalance(relayer);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("relayer", relayer);
        data.put("amount", amount);
        return ResponseEntity.ok(ApiResponse.ok(data));
    }

    @PostMapping("/gas-price/update")
    public ResponseEntity<ApiResponse<GasQuote>> updateGasPrice(
            @RequestHeader(CorrelationIdFilter.ACCOUNT_HEADER) String caller
    ) {
        return ResponseEntity.ok(ApiResponse.ok(feeOracle.updateGasPrice(caller)));
    }

    @PutMapping("/fee-multiplier")
    public ResponseEntity<ApiResponse<GasQuote>> setFeeMultiplier(
            @RequestHeader(CorrelationIdFilter.ACCOUNT_HEADER) String admin,
            @RequestBody FeeMultiplierRequest req
    ) {
        log.info("event=gas_relayer.fee_multiplier.request multiplier={}", req.multiplier());
        return ResponseEntity.ok(ApiResponse.ok(feeOracle.setFeeMultiplier(admin, req.multiplier())));
    }

    @PostMapping("/pause")
    public ResponseEntity<ApiResponse<Map<String, Object>>> pause(@RequestHeader(CorrelationIdFilter.ACCOUNT_HEADER) String admin) {
        boolean changed = feeOracle.pause(admin);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("paused", true, "changed", changed)));
    }

    @PostMapping("/unpause")
    public ResponseEntity<ApiResponse<Map<String, Object>>> unpause(@RequestHeader(CorrelationIdFilter.ACCOUNT_HEADER) String admin) {
        boolean changed = feeOracle.unpause(admin);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("paused", false, "changed", changed)));
    }

    @PostMapping("/emergency-withdraw")
    public ResponseEntity<ApiResponse<Map<String, Object>>> emergencyWithdraw(
            @RequestHeader(CorrelationIdFilter.ACCOUNT_HEADER) String admin,
            @RequestBody EmergencyWithdrawRequest req
    ) {
        log.warn("event=gas_relayer.emergency_withdraw.request to={} amount={}", req.to(), req.amount());
        BigInteger amount = feeOracle.emergencyWithdraw(admin, req.to(), req.amount());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("to", req.to());
        data.put("amount", amount);
        return ResponseEntity.ok(ApiResponse.ok(data));
    }
}
