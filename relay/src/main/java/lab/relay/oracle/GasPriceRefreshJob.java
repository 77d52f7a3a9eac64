package lab.relay.oracle;

import lab.relay.alert.AlertManager;
import lab.relay.alert.AlertSeverity;
import lab.relay.common.BridgeException;
import lab.relay.common.ErrorCode;
import lab.relay.config.RelayProperties;
import lab.relay.monitor.ChainMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class GasPriceRefreshJob {

    private final FeeOracle feeOracle;
    private final ChainMonitor chainMonitor;
    private final AlertManager alertManager;
    private final RelayProperties properties;

    @Scheduled(
            fixedDelayString = "${relay.fee-oracle.update-interval:PT1H}",
            initialDelayString = "${relay.fee-oracle.update-interval:PT1H}"
    )
    public void refresh() {
        if (!properties.getFeeOracle().isRefreshEnabled()) {
            return;
        }
        refreshOnce();
    }

    // Returns true when a new price was applied.
    public boolean refreshOnce() {
        try {
            GasQuote quote = feeOracle.updateGasPrice();
            log.info("event=gas_price_refresh.applied price={}", quote.price());
            return true;
        } catch (BridgeException e) {
            if (e.getCode() == ErrorCode.TOO_SOON || e.getCode() == ErrorCode.SYSTEM_PAUSED) {
                log.debug("event=gas_price_refresh.skipped reason={}", e.getCode());
                return false;
            }
            if (e.getCode() == ErrorCode.SUSPICIOUS_PRICE_MOVEMENT) {
                // already alerted by the oracle
                chainMonitor.recordError(e, AlertSeverity.WARNING);
                return false;
            }
            report(e);
            return false;
        } catch (RuntimeException e) {
            report(e);
            return false;
        }
    }

    private void report(RuntimeException e) {
        log.warn("event=gas_price_refresh.failed error={}", e.getMessage());
        chainMonitor.recordError(e, AlertSeverity.ERROR);
        alertManager.sendAlert("Gas price refresh failed", e.getMessage(), AlertSeverity.ERROR);
    }
}
