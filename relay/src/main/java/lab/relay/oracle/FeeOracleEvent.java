package lab.relay.oracle;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Events published after a fee oracle state change has been committed.
 */
public interface FeeOracleEvent {

    Instant timestamp();

    record GasPriceUpdated(BigInteger oldPrice, BigInteger newPrice, BigInteger deviationPercent, Instant timestamp)
            implements FeeOracleEvent {}

    record RelayerCompensated(String relayer, BigInteger gasUsed, BigInteger compensation, BigInteger dailyCompensated, Instant timestamp)
            implements FeeOracleEvent {}

    record RelayerBalanceWithdrawn(String relayer, BigInteger amount, String txHash, Instant timestamp)
            implements FeeOracleEvent {}

    record FeeMultiplierUpdated(int oldMultiplier, int newMultiplier, Instant timestamp)
            implements FeeOracleEvent {}

    record OracleEmergencyWithdrawal(String to, BigInteger amount, String txHash, Instant timestamp)
            implements FeeOracleEvent {}
}
