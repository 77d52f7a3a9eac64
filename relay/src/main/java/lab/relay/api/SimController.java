package lab.relay.api;

import lab.relay.adapter.InMemoryChainDataProvider;
import lab.relay.adapter.SimulatedDestinationChain;
import lab.relay.common.ApiResponse;
import lab.relay.ledger.InMemoryBridgeLedger;
import lab.relay.monitor.ChainMonitor;
import lab.relay.oracle.GasPriceRefreshJob;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.Map;

// Scripts the in-process chains so labs and integration tests can reproduce scenarios deterministically.
@RestController
@RequiredArgsConstructor
@RequestMapping("/sim")
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class SimController {

    private final InMemoryChainDataProvider sourceChain;
    private final SimulatedDestinationChain destinationChain;
    private final InMemoryBridgeLedger ledger;
    private final ChainMonitor chainMonitor;
    private final GasPriceRefreshJob gasPriceRefreshJob;

    public record SourceTransaction(BigInteger amount, String senderAddress, long confirmations) {}

    public record Mint(String account, BigInteger amount) {}

    @PutMapping("/source/transactions/{txId}")
    public void recordSourceTransaction(@PathVariable String txId, @RequestBody SourceTransaction tx) {
        sourceChain.record(txId, tx.amount(), tx.senderAddress(), tx.confirmations());
    }

    @PostMapping("/source/transactions/{txId}/confirmations/{confirmations}")
    public void setConfirmations(@PathVariable String txId, @PathVariable long confirmations) {
        sourceChain.setConfirmations(txId, confirmations);
    }

    @PostMapping("/destination/gas-price/{wei}")
    public void setGasPrice(@PathVariable BigInteger wei) {
        destinationChain.setGasPrice(wei);
    }

    // The next n destination reads time out.
    @PostMapping("/destination/fail-next-reads/{n}")
    public void failNextReads(@PathVariable int n) {
        destinationChain.failNextReads(n);
    }

    @PostMapping("/ledger/mint")
    public ResponseEntity<ApiResponse<Map<String, Object>>> mint(@RequestBody Mint mint) {
        ledger.mint(mint.account(), mint.amount());
        return ResponseEntity.ok(ApiResponse.ok(Map.of("account", mint.account(), "balance", ledger.balanceOf(mint.account()))));
    }

    @GetMapping("/ledger/balance/{account}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> balance(@PathVariable String account) {
        return ResponseEntity.ok(ApiResponse.ok(Map.of("account", account, "balance", ledger.balanceOf(account))));
    }

    // Run one monitor poll cycle now instead of waiting for the scheduler.
    @PostMapping("/monitor/poll")
    public ResponseEntity<ApiResponse<Map<String, Object>>> poll() {
        return ResponseEntity.ok(ApiResponse.ok(Map.of("examined", chainMonitor.runCycle())));
    }

    @PostMapping("/fee-oracle/refresh")
    public ResponseEntity<ApiResponse<Map<String, Object>>> refresh() {
        return ResponseEntity.ok(ApiResponse.ok(Map.of("applied", gasPriceRefreshJob.refreshOnce())));
    }
}
