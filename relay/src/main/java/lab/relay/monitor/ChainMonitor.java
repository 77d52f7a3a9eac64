package lab.relay.monitor;

import io.github.resilience4j.retry.Retry;
import lab.relay.adapter.ChainDataProvider;
import lab.relay.adapter.ChainDataProvider.ObservedTransaction;
import lab.relay.adapter.DestinationChain;
import lab.relay.address.EvmAddressValidator;
import lab.relay.alert.Alert;
import lab.relay.alert.AlertManager;
import lab.relay.alert.AlertSeverity;
import lab.relay.common.BridgeException;
import lab.relay.common.CorrelationIdFilter;
import lab.relay.common.ErrorCategory;
import lab.relay.common.ErrorCode;
import lab.relay.config.RelayProperties;
import lab.relay.domain.deposit.Deposit;
import lab.relay.domain.deposit.DepositStatus;
import lab.relay.orchestration.BridgeRelay;
import lab.relay.orchestration.NewDeposit;
import lab.relay.orchestration.ProcessingResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Watches the source chain for confirmation depth and hands deposits that reached the threshold
 * to {@link BridgeRelay}. Also owns the error ring and the health aggregate.
 *
 * <p>The poll loop is driven by the scheduler. Each cycle is independent: it re-reads PENDING
 * deposits from the store, so a crash or skipped cycle loses nothing. On shutdown the current
 * deposit is finished and the loop exits before the next one.
 */
@Component
@Slf4j
public class ChainMonitor implements SmartLifecycle {

    private final BridgeRelay bridgeRelay;
    private final ChainDataProvider chainDataProvider;
    private final DestinationChain destinationChain;
    private final AlertManager alertManager;
    private final Retry chainReadRetry;
    private final RelayProperties properties;
    private final Clock clock;
    private final long expectedChainId;
    private final HealthRecord healthRecord;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicLong cycleCounter = new AtomicLong();
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<HealthStatus.Status> lastReportedStatus = new AtomicReference<>();

    public ChainMonitor(
            BridgeRelay bridgeRelay,
            ChainDataProvider chainDataProvider,
            DestinationChain destinationChain,
            AlertManager alertManager,
            Retry chainReadRetry,
            RelayProperties properties,
            Clock clock,
            @Value("${relay.evm.chain-id:31337}") long expectedChainId
    ) {
        this.bridgeRelay = bridgeRelay;
        this.chainDataProvider = chainDataProvider;
        this.destinationChain = destinationChain;
        this.alertManager = alertManager;
        this.chainReadRetry = chainReadRetry;
        this.properties = properties;
        this.clock = clock;
        this.expectedChainId = expectedChainId;
        this.healthRecord = new HealthRecord(properties.getMonitor().getErrorBufferSize());
    }

    public Deposit addDepositInfo(String txId, DepositInfo info) {
        if (info == null) {
            throw new BridgeException(ErrorCode.INVALID_REQUEST, "deposit info is required");
        }
        return bridgeRelay.addDeposit(new NewDeposit(txId, info.sourceAddress(), info.destAddress(), info.amount()));
    }

    public ProcessingResult processTransaction(String txId) {
        return processTransaction(txId, null);
    }

    /**
     * Reads the confirmation depth of {@code txId} and processes the deposit once it is deep enough.
     * Domain rejections come back as a failed result; unknown transactions and infrastructure
     * failures are thrown.
     */
    public ProcessingResult processTransaction(String txId, String attestationSignature) {
        Deposit deposit = bridgeRelay.findBySourceTxId(txId)
                .orElseThrow(() -> BridgeException.notFound("deposit for source tx", txId));

        try {
            if (!deposit.getStatus().isTerminal()) {
                Optional<ObservedTransaction> observed = readTransaction(txId);
                long confirmations = observed.map(ObservedTransaction::confirmations).orElse(0L);
                if (observed.isEmpty() || confirmations < properties.getBridge().getRequiredConfirmations()) {
                    Deposit updated = bridgeRelay.recordConfirmations(deposit.getId(), confirmations);
                    log.info(
                            "event=chain_monitor.process.waiting txId={} depositId={} confirmations={} required={}",
                            txId,
                            deposit.getId(),
                            confirmations,
                            properties.getBridge().getRequiredConfirmations()
                    );
                    return ProcessingResult.insufficientConfirmations(updated);
                }
                BridgeException mismatch = sourceMismatch(deposit, observed.get());
                if (mismatch != null) {
                    bridgeRelay.rejectDeposit(deposit.getId(), mismatch);
                    recordError(mismatch, AlertSeverity.CRITICAL);
                    throw mismatch;
                }
                bridgeRelay.markConfirmed(deposit.getId(), confirmations);
            }
            return bridgeRelay.processDeposit(deposit.getId(), attestationSignature);
        } catch (BridgeException e) {
            if (e.getCategory() == ErrorCategory.NOT_FOUND || e.isRetryable()) {
                throw e;
            }
            Deposit current = bridgeRelay.getDeposit(deposit.getId());
            return ProcessingResult.failed(current.getId(), current.getStatus(), current.getConfirmations(), e);
        }
    }

    /**
     * Appends to the error ring. Critical errors also raise an alert without waiting for delivery.
     * Never throws.
     */
    public void recordError(Throwable error, AlertSeverity severity) {
        try {
            AlertSeverity effective = severity == null ? AlertSeverity.ERROR : severity;
            String type = error == null ? "Unknown" : error.getClass().getSimpleName();
            String message = error == null ? "" : String.valueOf(error.getMessage());
            healthRecord.append(new HealthRecord.ErrorEntry(clock.instant(), type, message, effective));
            log.warn("event=chain_monitor.error.recorded type={} severity={} message={}", type, effective.wireName(), message);

            if (effective == AlertSeverity.CRITICAL) {
                Alert alert = new Alert(
                        "Critical relay error",
                        type + ": " + message,
                        AlertSeverity.CRITICAL,
                        properties.getEnvironment(),
                        clock.instant().toString()
                );
                healthRecord.setLastAlert(alert);
                alertManager.sendAlert(alert.title(), alert.message(), alert.severity());
            }
        } catch (RuntimeException e) {
            log.error("event=chain_monitor.error.record_failed error={}", e.toString());
        }
    }

    public Optional<Alert> getLastAlert() {
        return healthRecord.getLastAlert();
    }

    public HealthStatus getHealthStatus() {
        Map<String, HealthStatus.Check> checks = new LinkedHashMap<>();

        try {
            long remoteChainId = destinationChain.chainId();
            checks.put("provider", new HealthStatus.Check(
                    remoteChainId == expectedChainId,
                    "chainId=" + remoteChainId + " expected=" + expectedChainId));
        } catch (RuntimeException e) {
            checks.put("provider", new HealthStatus.Check(false, "unreachable: " + e.getMessage()));
        }

        RelayProperties.FeeOracle oracle = properties.getFeeOracle();
        try {
            BigInteger gasPrice = destinationChain.gasPrice();
            boolean withinBounds = gasPrice.compareTo(oracle.getMinGasPrice()) >= 0
                    && gasPrice.compareTo(oracle.getMaxGasPrice()) <= 0;
            checks.put("gasPrice", new HealthStatus.Check(
                    withinBounds,
                    "current=" + gasPrice + " min=" + oracle.getMinGasPrice() + " max=" + oracle.getMaxGasPrice()));
        } catch (RuntimeException e) {
            checks.put("gasPrice", new HealthStatus.Check(false, "unavailable: " + e.getMessage()));
        }

        Instant now = clock.instant();
        long recentErrors = healthRecord.countSince(now.minus(properties.getMonitor().getRecentErrorWindow()));
        int maxRecentErrors = properties.getMonitor().getMaxRecentErrors();
        checks.put("recentErrors", new HealthStatus.Check(
                recentErrors <= maxRecentErrors,
                "count=" + recentErrors + " max=" + maxRecentErrors));

        Map<String, String> contracts = new LinkedHashMap<>();
        contracts.put("bridge", properties.getBridge().getContractAddress());
        contracts.put("token", properties.getBridge().getTokenAddress());
        contracts.put("feePool", oracle.getPoolAddress());
        contracts.forEach((name, address) -> checks.put(
                "contract." + name,
                new HealthStatus.Check(EvmAddressValidator.isEvmAddress(address), String.valueOf(address))));

        List<String> failing = new ArrayList<>();
        checks.forEach((name, check) -> {
            if (!check.ok()) {
                failing.add(name);
            }
        });
        HealthStatus.Status status = failing.isEmpty() ? HealthStatus.Status.HEALTHY : HealthStatus.Status.UNHEALTHY;
        return new HealthStatus(status, checks, failing, healthRecord.snapshot(), now);
    }

    // Health as served to operators; a health-check alert goes out only when the status flips.
    public HealthStatus reportHealth() {
        HealthStatus health = getHealthStatus();
        HealthStatus.Status previous = lastReportedStatus.getAndSet(health.status());
        if (previous != health.status()) {
            log.info("event=chain_monitor.health.changed previous={} current={} failing={}", previous, health.status(), health.failingChecks());
            alertManager.sendHealthCheck(
                    "Bridge Relay",
                    health.isHealthy(),
                    health.isHealthy() ? "" : "failing checks: " + String.join(", ", health.failingChecks())
            );
        }
        return health;
    }

    // ---------------------------------------------------------------- poll loop

    @Scheduled(
            fixedDelayString = "${relay.monitor.poll-interval:PT30S}",
            initialDelayString = "${relay.monitor.poll-interval:PT30S}"
    )
    public void poll() {
        if (!properties.getMonitor().isPollEnabled() || !running.get()) {
            return;
        }
        runCycle();
    }

    /**
     * One pass over all PENDING deposits. Returns the number of deposits examined.
     * A failure on one deposit is recorded and the cycle moves on.
     */
    public int runCycle() {
        if (!cycleLock.tryLock()) {
            log.debug("event=chain_monitor.cycle.skipped reason=previous_cycle_running");
            return 0;
        }
        String cycleId = "poll-" + cycleCounter.incrementAndGet();
        MDC.put(CorrelationIdFilter.MDC_CORRELATION_ID_KEY, cycleId);
        int examined = 0;
        try {
            List<Deposit> pending = bridgeRelay.listPendingDeposits();
            log.debug("event=chain_monitor.cycle.start pending={}", pending.size());
            Instant expiryCutoff = clock.instant().minus(properties.getMonitor().getPendingTtl());

            for (Deposit deposit : pending) {
                if (stopping.get()) {
                    log.info("event=chain_monitor.cycle.interrupted examined={} reason=shutdown", examined);
                    break;
                }
                examined++;
                try {
                    if (deposit.getFirstSeenAt().isBefore(expiryCutoff)) {
                        expire(deposit);
                    } else {
                        processTransaction(deposit.getSourceTxId());
                    }
                } catch (BridgeException e) {
                    recordError(e, e.getCategory() == ErrorCategory.FATAL_INVARIANT ? AlertSeverity.CRITICAL : AlertSeverity.WARNING);
                } catch (RuntimeException e) {
                    recordError(e, AlertSeverity.ERROR);
                }
            }
            log.info("event=chain_monitor.cycle.done examined={}", examined);
            return examined;
        } finally {
            MDC.remove(CorrelationIdFilter.MDC_CORRELATION_ID_KEY);
            cycleLock.unlock();
        }
    }

    private void expire(Deposit deposit) {
        Deposit expired = bridgeRelay.expireDeposit(deposit.getId());
        if (expired.getStatus() == DepositStatus.FAILED) {
            alertManager.sendAlert(
                    "Deposit expired",
                    "Deposit " + deposit.getId() + " (source tx " + deposit.getSourceTxId() + ") stayed PENDING past "
                            + properties.getMonitor().getPendingTtl() + " with " + deposit.getConfirmations() + " confirmations",
                    AlertSeverity.WARNING
            );
        }
    }

    private Optional<ObservedTransaction> readTransaction(String txId) {
        return Retry.decorateSupplier(chainReadRetry, () -> chainDataProvider.getTransaction(txId)).get();
    }

    // The registration is only a claim; the source transaction decides what may be minted.
    private static BridgeException sourceMismatch(Deposit deposit, ObservedTransaction observed) {
        boolean amountMatches = observed.amount() != null && observed.amount().compareTo(deposit.getAmount()) == 0;
        String sender = observed.senderAddress();
        boolean senderMatches = sender == null || sender.isBlank() || sender.equals(deposit.getSourceAddress());
        if (amountMatches && senderMatches) {
            return null;
        }
        log.warn(
                "event=chain_monitor.process.mismatch txId={} depositId={} registeredAmount={} observedAmount={} registeredSender={} observedSender={}",
                deposit.getSourceTxId(),
                deposit.getId(),
                deposit.getAmount(),
                observed.amount(),
                deposit.getSourceAddress(),
                sender
        );
        return new BridgeException(
                ErrorCode.SOURCE_TX_MISMATCH,
                "SourceTxMismatch: " + deposit.getSourceTxId() + " does not pay the registered "
                        + (amountMatches ? "sender" : "amount"),
                Map.of(
                        "depositId", deposit.getId(),
                        "registeredAmount", deposit.getAmount().toString(),
                        "observedAmount", String.valueOf(observed.amount()),
                        "observedSender", String.valueOf(sender)
                )
        );
    }

    // ---------------------------------------------------------------- lifecycle

    @Override
    public void start() {
        stopping.set(false);
        running.set(true);
        log.info("event=chain_monitor.lifecycle.started pollEnabled={} interval={}",
                properties.getMonitor().isPollEnabled(), properties.getMonitor().getPollInterval());
    }

    @Override
    public void stop() {
        stopping.set(true);
        running.set(false);
        try {
            long timeoutMs = properties.getMonitor().getShutdownTimeout().toMillis();
            if (cycleLock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                cycleLock.unlock();
                log.info("event=chain_monitor.lifecycle.stopped");
            } else {
                log.warn("event=chain_monitor.lifecycle.stop_timeout timeoutMs={}", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("event=chain_monitor.lifecycle.stop_interrupted");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }
}
