package lab.relay.oracle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class FeeOracleEventLogger {

    @EventListener
    public void on(FeeOracleEvent event) {
        if (event instanceof FeeOracleEvent.GasPriceUpdated e) {
            log.info("event=fee_oracle.gas_price_updated oldPrice={} newPrice={} deviationPercent={}",
                    e.oldPrice(), e.newPrice(), e.deviationPercent());
        } else if (event instanceof FeeOracleEvent.RelayerCompensated e) {
            log.info("event=fee_oracle.relayer_compensated relayer={} gasUsed={} compensation={} dailyCompensated={}",
                    e.relayer(), e.gasUsed(), e.compensation(), e.dailyCompensated());
        } else if (event instanceof FeeOracleEvent.RelayerBalanceWithdrawn e) {
            log.info("event=fee_oracle.relayer_balance_withdrawn relayer={} amount={} txHash={}",
                    e.relayer(), e.amount(), e.txHash());
        } else if (event instanceof FeeOracleEvent.FeeMultiplierUpdated e) {
            log.info("event=fee_oracle.fee_multiplier_updated old={} new={}", e.oldMultiplier(), e.newMultiplier());
        } else if (event instanceof FeeOracleEvent.OracleEmergencyWithdrawal e) {
            log.warn("event=fee_oracle.emergency_withdrawal to={} amount={} txHash={}", e.to(), e.amount(), e.txHash());
        }
    }
}
