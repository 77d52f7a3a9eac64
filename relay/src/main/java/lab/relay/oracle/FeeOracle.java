package lab.relay.oracle;

import io.github.resilience4j.retry.Retry;
import jakarta.annotation.PostConstruct;
import lab.relay.adapter.DestinationChain;
import lab.relay.address.EvmAddressValidator;
import lab.relay.alert.AlertManager;
import lab.relay.alert.AlertSeverity;
import lab.relay.common.AccessControl;
import lab.relay.common.BridgeException;
import lab.relay.common.EmergencyStop;
import lab.relay.common.ErrorCode;
import lab.relay.common.Role;
import lab.relay.config.RelayProperties;
import lab.relay.domain.oracle.FeeOracleState;
import lab.relay.domain.oracle.FeeOracleStateRepository;
import lab.relay.domain.oracle.RelayerAccount;
import lab.relay.domain.oracle.RelayerAccountRepository;
import lab.relay.ledger.BridgeLedger;
import lab.relay.ledger.LedgerReceipt;
import lab.relay.ledger.LedgerRevertException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Gas price quote, relayer compensation and the daily compensation circuit breaker.
 *
 * <p>All writes to {@link FeeOracleState} and {@link RelayerAccount} happen while holding one
 * lock, with the database transaction opened inside it, so a cap check and the increment it
 * guards can never interleave with another compensation or withdrawal. Quote reads use a
 * volatile snapshot and never take the lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeeOracle {

    static final Duration DAILY_WINDOW = Duration.ofHours(24);
    static final int MIN_MULTIPLIER = 100;
    static final int MAX_MULTIPLIER = 150;
    private static final BigInteger HUNDRED = BigInteger.valueOf(100);
    private static final BigInteger MAX_DEVIATION_PERCENT = BigInteger.valueOf(50);
    private static final BigInteger ALERT_DEVIATION_PERCENT = BigInteger.valueOf(30);

    private final FeeOracleStateRepository stateRepository;
    private final RelayerAccountRepository relayerAccountRepository;
    private final DestinationChain destinationChain;
    private final BridgeLedger ledger;
    private final AccessControl accessControl;
    private final EmergencyStop emergencyStop;
    private final AlertManager alertManager;
    private final ApplicationEventPublisher eventPublisher;
    private final Retry chainReadRetry;
    private final TransactionTemplate transactionTemplate;
    private final RelayProperties properties;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile GasQuote quote;

    @PostConstruct
    public void init() {
        FeeOracleState state = transactionTemplate.execute(status ->
                stateRepository.findById(FeeOracleState.SINGLETON_ID)
                        .orElseGet(() -> stateRepository.save(
                                FeeOracleState.initial(config().getInitialGasPrice(), config().getFeeMultiplier(), clock.instant()))));
        if (state == null) {
            throw new IllegalStateException("failed to initialize fee oracle state");
        }
        publishQuote(state);
        log.info("event=fee_oracle.init price={} multiplier={} dailyCap={}", state.getGasPrice(), state.getFeeMultiplier(), config().getDailyCap());
    }

    // ---------------------------------------------------------------- gas price

    public GasQuote updateGasPrice(String caller) {
        accessControl.require(Role.ORACLE, caller);
        return updateGasPrice();
    }

    /**
     * Pulls the observed network price and applies it if the update interval has elapsed and the
     * price passes the bounds and deviation gates. Rejections leave the quote untouched.
     */
    public GasQuote updateGasPrice() {
        emergencyStop.ensureNotPaused("updateGasPrice");
        ensureIntervalElapsed(quote.lastUpdatedAt());

        BigInteger observed = Retry.decorateSupplier(chainReadRetry, destinationChain::gasPrice).get();
        if (observed.compareTo(config().getMinGasPrice()) < 0 || observed.compareTo(config().getMaxGasPrice()) > 0) {
            log.warn("event=fee_oracle.update.rejected reason=out_of_bounds observed={}", observed);
            throw new BridgeException(
                    ErrorCode.INVALID_GAS_PRICE,
                    "InvalidGasPrice(" + observed + ")",
                    Map.of("observed", observed.toString(), "min", config().getMinGasPrice().toString(), "max", config().getMaxGasPrice().toString())
            );
        }

        lock.lock();
        try {
            FeeOracleState state = loadState();
            // Another caller may have applied an update while the price was being read.
            ensureIntervalElapsed(state.getLastUpdatedAt());

            BigInteger old = state.getGasPrice();
            BigInteger scaledDiff = observed.subtract(old).abs().multiply(HUNDRED);
            BigInteger deviationPercent = old.signum() == 0 ? BigInteger.ZERO : scaledDiff.divide(old);
            if (old.signum() != 0 && scaledDiff.compareTo(MAX_DEVIATION_PERCENT.multiply(old)) > 0) {
                log.warn("event=fee_oracle.update.rejected reason=suspicious_movement old={} observed={} deviationPercent={}",
                        old, observed, deviationPercent);
                alertManager.sendAlert(
                        "Suspicious gas price movement",
                        "Rejected gas price update from " + old + " to " + observed + " (" + deviationPercent + "%)",
                        AlertSeverity.ERROR
                );
                throw new BridgeException(
                        ErrorCode.SUSPICIOUS_PRICE_MOVEMENT,
                        "SuspiciousPriceMovement(" + old + ", " + observed + ")",
                        Map.of("oldPrice", old.toString(), "newPrice", observed.toString(), "deviationPercent", deviationPercent.toString())
                );
            }
            boolean largeMove = old.signum() != 0 && scaledDiff.compareTo(ALERT_DEVIATION_PERCENT.multiply(old)) > 0;

            Instant now = clock.instant();
            FeeOracleState saved = transactionTemplate.execute(status -> {
                state.setGasPrice(observed);
                state.setLastUpdatedAt(now);
                return stateRepository.save(state);
            });
            publishQuote(saved);

            if (largeMove) {
                alertManager.sendAlert(
                        "Large gas price movement",
                        "Gas price moved from " + old + " to " + observed + " (" + deviationPercent + "%)",
                        AlertSeverity.WARNING
                );
            }
            eventPublisher.publishEvent(new FeeOracleEvent.GasPriceUpdated(old, observed, deviationPercent, now));
            return quote;
        } finally {
            lock.unlock();
        }
    }

    public GasQuote getQuote() {
        return quote;
    }

    // Pure: reads the published quote only.
    public BigInteger estimateFee(BigInteger gasLimit) {
        requirePositiveGas(gasLimit, "gasLimit");
        return quote.feeFor(gasLimit);
    }

    public GasQuote setFeeMultiplier(String admin, int multiplier) {
        accessControl.require(Role.ADMIN, admin);
        emergencyStop.ensureNotPaused("setFeeMultiplier");
        if (multiplier < MIN_MULTIPLIER) {
            throw new BridgeException(ErrorCode.INVALID_MULTIPLIER, "Multiplier must be >= " + MIN_MULTIPLIER);
        }
        if (multiplier > MAX_MULTIPLIER) {
            throw new BridgeException(ErrorCode.INVALID_MULTIPLIER, "Multiplier must be <= " + MAX_MULTIPLIER);
        }

        lock.lock();
        try {
            FeeOracleState state = loadState();
            int old = state.getFeeMultiplier();
            FeeOracleState saved = transactionTemplate.execute(status -> {
                state.setFeeMultiplier(multiplier);
                return stateRepository.save(state);
            });
            publishQuote(saved);
            eventPublisher.publishEvent(new FeeOracleEvent.FeeMultiplierUpdated(old, multiplier, clock.instant()));
            return quote;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- compensation

    /**
     * Credits {@code relayer} with {@code price * gasUsed * multiplier / 100}. The whole credit is
     * rejected when it would push the rolling 24h total over the daily cap.
     */
    public BigInteger compensateRelayer(String caller, String relayer, BigInteger gasUsed) {
        accessControl.require(Role.RELAYER, caller);
        emergencyStop.ensureNotPaused("compensateRelayer");
        String account = normalizeAccount(relayer);
        requirePositiveGas(gasUsed, "gasUsed");

        lock.lock();
        try {
            Instant now = clock.instant();
            FeeOracleEvent.RelayerCompensated event = transactionTemplate.execute(status -> {
                FeeOracleState state = loadState();
                if (windowElapsed(state.getLastDailyReset(), now)) {
                    log.info("event=fee_oracle.daily_reset previous={} resetAt={}", state.getDailyCompensated(), now);
                    state.setDailyCompensated(BigInteger.ZERO);
                    state.setLastDailyReset(now);
                }

                BigInteger compensation = new GasQuote(state.getGasPrice(), state.getLastUpdatedAt(), state.getFeeMultiplier())
                        .feeFor(gasUsed);
                BigInteger projected = state.getDailyCompensated().add(compensation);
                if (projected.compareTo(config().getDailyCap()) > 0) {
                    log.warn("event=fee_oracle.compensate.rejected reason=daily_limit relayer={} compensation={} dailyCompensated={} cap={}",
                            account, compensation, state.getDailyCompensated(), config().getDailyCap());
                    throw new BridgeException(
                            ErrorCode.DAILY_LIMIT_EXCEEDED,
                            "DailyLimitExceeded",
                            Map.of(
                                    "compensation", compensation.toString(),
                                    "dailyCompensated", state.getDailyCompensated().toString(),
                                    "dailyCap", config().getDailyCap().toString()
                            )
                    );
                }

                RelayerAccount relayerAccount = relayerAccountRepository.findById(account)
                        .orElseGet(() -> RelayerAccount.open(account, now));
                relayerAccount.credit(compensation, windowElapsed(relayerAccount.getLastDailyReset(), now), now);
                relayerAccountRepository.save(relayerAccount);

                state.setDailyCompensated(projected);
                state.setTotalCompensated(state.getTotalCompensated().add(compensation));
                stateRepository.save(state);
                return new FeeOracleEvent.RelayerCompensated(account, gasUsed, compensation, projected, now);
            });
            if (event == null) {
                throw new IllegalStateException("compensation for " + account + " returned no result");
            }
            eventPublisher.publishEvent(event);
            return event.compensation();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pays out the relayer's whole accrued balance from the fee pool. The balance is drained before
     * the transfer is sent and restored only when the ledger rejected the transfer. When the outcome
     * is unknown the balance stays drained and the payout is left for reconciliation.
     */
    public BigInteger withdrawBalance(String relayer) {
        emergencyStop.ensureNotPaused("withdrawBalance");
        String account = normalizeAccount(relayer);

        lock.lock();
        try {
            BigInteger balance = relayerAccountRepository.findById(account)
                    .map(RelayerAccount::getAccruedBalance)
                    .orElse(BigInteger.ZERO);
            if (balance.signum() == 0) {
                throw BridgeException.insufficientBalance(BigInteger.ZERO, BigInteger.ZERO);
            }
            BigInteger available = poolBalance();
            if (available.compareTo(balance) < 0) {
                throw BridgeException.insufficientBalance(balance, available);
            }

            transactionTemplate.executeWithoutResult(status -> {
                RelayerAccount relayerAccount = loadRelayer(account);
                relayerAccount.drain();
                relayerAccountRepository.save(relayerAccount);
            });

            LedgerReceipt receipt;
            try {
                receipt = transferFromPool(account, balance, "withdrawBalance");
            } catch (RuntimeException e) {
                if (e instanceof BridgeException && ((BridgeException) e).getCode() == ErrorCode.TRANSFER_FAILED) {
                    restoreBalance(account, balance);
                } else {
                    log.error("event=fee_oracle.withdraw.outcome_unknown relayer={} amount={} error={}", account, balance, e.getMessage());
                    alertManager.sendAlert(
                            "Relayer payout outcome unknown",
                            "withdrawBalance of " + balance + " to " + account + " may have been sent (" + e.getMessage()
                                    + "); balance left drained until the pool transfer is reconciled",
                            AlertSeverity.CRITICAL
                    );
                }
                throw e;
            }
            eventPublisher.publishEvent(new FeeOracleEvent.RelayerBalanceWithdrawn(account, balance, receipt.txHash(), clock.instant()));
            return balance;
        } finally {
            lock.unlock();
        }
    }

    // Admin escape hatch; the only fund movement allowed while paused.
    public BigInteger emergencyWithdraw(String admin, String to, BigInteger amount) {
        accessControl.require(Role.ADMIN, admin);
        String recipient = normalizeAccount(to);
        if (amount == null || amount.signum() <= 0) {
            throw new BridgeException(ErrorCode.INVALID_AMOUNT, "Invalid amount");
        }

        lock.lock();
        try {
            BigInteger available = poolBalance();
            if (available.compareTo(amount) < 0) {
                throw BridgeException.insufficientBalance(amount, available);
            }
            LedgerReceipt receipt = transferFromPool(recipient, amount, "emergencyWithdraw");
            alertManager.sendAlert(
                    "Emergency withdrawal",
                    "Admin " + admin + " withdrew " + amount + " from the fee pool to " + recipient,
                    AlertSeverity.WARNING
            );
            eventPublisher.publishEvent(new FeeOracleEvent.OracleEmergencyWithdrawal(recipient, amount, receipt.txHash(), clock.instant()));
            return amount;
        } finally {
            lock.unlock();
        }
    }

    public boolean pause(String admin) {
        accessControl.require(Role.ADMIN, admin);
        return emergencyStop.pause();
    }

    public boolean unpause(String admin) {
        accessControl.require(Role.ADMIN, admin);
        return emergencyStop.unpause();
    }

    // ---------------------------------------------------------------- reads

    public BigInteger getRelayerBalance(String relayer) {
        return getRelayerAccount(relayer).map(RelayerAccount::getAccruedBalance).orElse(BigInteger.ZERO);
    }

    public Optional<RelayerAccount> getRelayerAccount(String relayer) {
        return relayerAccountRepository.findById(normalizeAccount(relayer));
    }

    public FeeOracleState getState() {
        return loadState();
    }

    // ---------------------------------------------------------------- internals

    private LedgerReceipt transferFromPool(String to, BigInteger amount, String operation) {
        try {
            return ledger.transfer(config().getPoolAddress(), to, amount);
        } catch (LedgerRevertException e) {
            log.error("event=fee_oracle.transfer.failed operation={} to={} amount={} reason={}", operation, to, amount, e.getReason());
            alertManager.sendAlert(
                    "Fee pool transfer failed",
                    operation + " of " + amount + " to " + to + " reverted: " + e.getReason(),
                    AlertSeverity.CRITICAL
            );
            throw new BridgeException(
                    ErrorCode.TRANSFER_FAILED,
                    "TransferFailed",
                    Map.of("operation", operation, "revertReason", String.valueOf(e.getReason())),
                    e
            );
        }
    }

    private void restoreBalance(String account, BigInteger amount) {
        transactionTemplate.executeWithoutResult(status -> {
            RelayerAccount relayerAccount = loadRelayer(account);
            relayerAccount.restore(amount);
            relayerAccountRepository.save(relayerAccount);
        });
        log.warn("event=fee_oracle.withdraw.restored relayer={} amount={}", account, amount);
    }

    private RelayerAccount loadRelayer(String account) {
        return relayerAccountRepository.findById(account)
                .orElseThrow(() -> BridgeException.notFound("relayer", account));
    }

    private RelayProperties.FeeOracle config() {
        return properties.getFeeOracle();
    }

    private BigInteger poolBalance() {
        return Retry.decorateSupplier(chainReadRetry, () -> ledger.balanceOf(config().getPoolAddress())).get();
    }

    private void ensureIntervalElapsed(Instant lastUpdatedAt) {
        Instant nextAllowed = lastUpdatedAt.plus(config().getUpdateInterval());
        if (clock.instant().isBefore(nextAllowed)) {
            throw new BridgeException(
                    ErrorCode.TOO_SOON,
                    "Too soon to update",
                    Map.of("nextUpdateAt", nextAllowed.toString())
            );
        }
    }

    private static boolean windowElapsed(Instant lastReset, Instant now) {
        return !now.isBefore(lastReset.plus(DAILY_WINDOW));
    }

    private FeeOracleState loadState() {
        return stateRepository.findById(FeeOracleState.SINGLETON_ID)
                .orElseThrow(() -> new BridgeException(ErrorCode.INVARIANT_VIOLATION, "fee oracle state missing"));
    }

    private void publishQuote(FeeOracleState state) {
        this.quote = new GasQuote(state.getGasPrice(), state.getLastUpdatedAt(), state.getFeeMultiplier());
    }

    private static void requirePositiveGas(BigInteger gas, String field) {
        if (gas == null || gas.signum() <= 0) {
            throw new BridgeException(ErrorCode.INVALID_GAS_LIMIT, field + " must be positive", Map.of("field", field));
        }
    }

    private static String normalizeAccount(String account) {
        if (!EvmAddressValidator.isEvmAddress(account)) {
            throw new BridgeException(ErrorCode.INVALID_ADDRESS, "Invalid address: " + account);
        }
        return account.toLowerCase(Locale.ROOT);
    }
}
