package lab.relay.orchestration;

import io.github.resilience4j.retry.Retry;
import lab.relay.address.AddressValidatorRouter;
import lab.relay.address.EvmAddressValidator;
import lab.relay.alert.AlertManager;
import lab.relay.alert.AlertSeverity;
import lab.relay.attestation.AttestationMessage;
import lab.relay.attestation.AttestationSigner;
import lab.relay.attestation.AttestationVerifier;
import lab.relay.attestation.DepositIds;
import lab.relay.common.AccessControl;
import lab.relay.common.BridgeException;
import lab.relay.common.EmergencyStop;
import lab.relay.common.ErrorCode;
import lab.relay.common.Role;
import lab.relay.config.RelayProperties;
import lab.relay.domain.deposit.Deposit;
import lab.relay.domain.deposit.DepositRepository;
import lab.relay.domain.deposit.DepositStatus;
import lab.relay.domain.withdrawal.Withdrawal;
import lab.relay.domain.withdrawal.WithdrawalRepository;
import lab.relay.domain.withdrawal.WithdrawalStatus;
import lab.relay.ledger.BridgeLedger;
import lab.relay.ledger.LedgerReceipt;
import lab.relay.ledger.LedgerRevertException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the deposit and withdrawal registries and is the only component that submits to the ledger.
 *
 * <p>Work on one deposit id is serialized by a per-id lock so two callers can never both reach the
 * mint. Ledger submissions are never retried here: a caller that sees {@code RPC_UNAVAILABLE} does
 * not know whether the call landed, and the next {@link #processDeposit} consults the ledger's
 * replay set before submitting again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BridgeRelay {

    private final DepositRepository depositRepository;
    private final WithdrawalRepository withdrawalRepository;
    private final BridgeLedger ledger;
    private final AttestationSigner attestationSigner;
    private final AttestationVerifier attestationVerifier;
    private final AddressValidatorRouter addressValidators;
    private final AccessControl accessControl;
    private final EmergencyStop emergencyStop;
    private final AlertManager alertManager;
    private final Retry chainReadRetry;
    private final TransactionTemplate transactionTemplate;
    private final RelayProperties properties;
    private final Clock clock;

    private final ConcurrentHashMap<String, ReentrantLock> sourceTxLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> depositLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> accountLocks = new ConcurrentHashMap<>();

    // ---------------------------------------------------------------- deposits

    public Deposit addDeposit(NewDeposit request) {
        validateNewDeposit(request);
        String depositId = DepositIds.derive(request.destAddress(), request.amount(), request.sourceTxId());
        log.info(
                "event=bridge_relay.add_deposit.start depositId={} sourceTxId={} destAddress={} amount={}",
                depositId,
                request.sourceTxId(),
                request.destAddress(),
                request.amount()
        );

        // Conflicting payloads for one source tx derive different ids, so registration is keyed by the tx.
        return withLock(sourceTxLocks, request.sourceTxId(), () -> {
            Deposit result;
            try {
                result = transactionTemplate.execute(status ->
                        depositRepository.findBySourceTxId(request.sourceTxId())
                                .map(existing -> validateIdempotentDeposit(existing, request))
                                .orElseGet(() -> depositRepository.save(Deposit.pending(
                                        depositId,
                                        request.sourceTxId(),
                                        request.sourceAddress(),
                                        request.destAddress(),
                                        request.amount(),
                                        clock.instant()
                                )))
                );
            } catch (DataIntegrityViolationException e) {
                // Another relay instance registered the same source tx first.
                log.warn("event=bridge_relay.add_deposit.race sourceTxId={} error={}", request.sourceTxId(), e.getMostSpecificCause().getMessage());
                result = depositRepository.findBySourceTxId(request.sourceTxId())
                        .map(existing -> validateIdempotentDeposit(existing, request))
                        .orElseThrow(() -> e);
            }
            if (result == null) {
                throw new IllegalStateException("failed to add deposit " + depositId);
            }
            log.info("event=bridge_relay.add_deposit.done depositId={} status={}", result.getId(), result.getStatus());
            return result;
        });
    }

    // Records a confirmation count below the threshold; the deposit stays PENDING.
    public Deposit recordConfirmations(String depositId, long confirmations) {
        return withLock(depositLocks, depositId, () -> {
            Deposit deposit = loadDeposit(depositId);
            if (deposit.getStatus().isTerminal() || deposit.getConfirmations() == confirmations) {
                return deposit;
            }
            deposit.recordConfirmations(confirmations, clock.instant());
            return depositRepository.save(deposit);
        });
    }

    public Deposit markConfirmed(String depositId, long confirmations) {
        return withLock(depositLocks, depositId, () -> {
            Deposit deposit = loadDeposit(depositId);
            requireConfirmations(deposit, confirmations);
            deposit.markConfirmed(confirmations, clock.instant());
            Deposit saved = depositRepository.save(deposit);
            log.info("event=bridge_relay.deposit.confirmed depositId={} confirmations={}", depositId, confirmations);
            return saved;
        });
    }

    public ProcessingResult processDeposit(String depositId) {
        return processDeposit(depositId, null);
    }

    /**
     * Mints the deposit on the ledger. {@code suppliedSignature} is an attestation issued elsewhere;
     * when absent the operator signer issues one. Every rejection after validation starts leaves the
     * deposit FAILED and is rethrown as a {@link BridgeException}.
     */
    public ProcessingResult processDeposit(String depositId, String suppliedSignature) {
        emergencyStop.ensureNotPaused("processDeposit");
        return withLock(depositLocks, depositId, () -> {
            Deposit deposit = loadDeposit(depositId);
            log.info("event=bridge_relay.process.start depositId={} status={} confirmations={}",
                    depositId, deposit.getStatus(), deposit.getConfirmations());

            if (deposit.getStatus() == DepositStatus.COMPLETED) {
                throw new BridgeException(
                        ErrorCode.ALREADY_PROCESSED,
                        BridgeLedger.REASON_ALREADY_PROCESSED,
                        Map.of("depositId", depositId, "mintTxHash", String.valueOf(deposit.getMintTxHash()))
                );
            }
            if (deposit.getStatus() == DepositStatus.FAILED) {
                throw new BridgeException(
                        deposit.getFailureCode() == null ? ErrorCode.INVALID_STATE : deposit.getFailureCode(),
                        deposit.getFailureReason(),
                        Map.of("depositId", depositId, "status", DepositStatus.FAILED.name())
                );
            }
            requireConfirmations(deposit, deposit.getConfirmations());
            if (deposit.getStatus() == DepositStatus.PENDING) {
                deposit.markConfirmed(deposit.getConfirmations(), clock.instant());
                deposit = depositRepository.save(deposit);
            }

            AttestationMessage message = new AttestationMessage(deposit.getDestAddress(), deposit.getAmount(), depositId);
            String signature = suppliedSignature == null || suppliedSignature.isBlank()
                    ? attestationSigner.sign(message)
                    : suppliedSignature.trim();
            if (!attestationVerifier.isAuthorized(message, signature)) {
                throw fail(deposit, new BridgeException(
                        ErrorCode.INVALID_SIGNATURE,
                        BridgeLedger.REASON_INVALID_SIGNATURE,
                        Map.of("depositId", depositId)
                ));
            }

            // A previous submission may have landed even though the caller saw a transport failure.
            if (readWithRetry(() -> ledger.isProcessed(depositId))) {
                log.warn("event=bridge_relay.process.reconciled depositId={} reason=ledger_already_processed", depositId);
                deposit.markCompleted(signature, null, clock.instant());
                return ProcessingResult.completed(depositRepository.save(deposit));
            }

            LedgerReceipt receipt;
            try {
                receipt = ledger.processDeposit(deposit.getDestAddress(), deposit.getAmount(), depositId, signature);
            } catch (LedgerRevertException e) {
                throw fail(deposit, mapDepositRevert(depositId, e));
            }

            deposit.markCompleted(signature, receipt.txHash(), clock.instant());
            Deposit saved = depositRepository.save(deposit);
            log.info("event=bridge_relay.process.completed depositId={} mintTxHash={}", depositId, receipt.txHash());
            return ProcessingResult.completed(saved);
        });
    }

    /**
     * Fails a deposit that can never be minted, for example because the source transaction does not
     * pay what was registered. Terminal deposits are returned unchanged.
     */
    public Deposit rejectDeposit(String depositId, BridgeException reason) {
        return withLock(depositLocks, depositId, () -> {
            Deposit deposit = loadDeposit(depositId);
            if (deposit.getStatus().isTerminal()) {
                return deposit;
            }
            fail(deposit, reason);
            return deposit;
        });
    }

    // Abandoned deposits: PENDING past the TTL can no longer be processed.
    public Deposit expireDeposit(String depositId) {
        return withLock(depositLocks, depositId, () -> {
            Deposit deposit = loadDeposit(depositId);
            if (deposit.getStatus() != DepositStatus.PENDING) {
                return deposit;
            }
            deposit.markFailed(ErrorCode.DEPOSIT_EXPIRED, "EXPIRED", clock.instant());
            log.warn("event=bridge_relay.deposit.expired depositId={} firstSeenAt={}", depositId, deposit.getFirstSeenAt());
            return depositRepository.save(deposit);
        });
    }

    public Deposit getDeposit(String depositId) {
        return loadDeposit(depositId);
    }

    public Optional<Deposit> findBySourceTxId(String sourceTxId) {
        return depositRepository.findBySourceTxId(sourceTxId);
    }

    public List<Deposit> listPendingDeposits() {
        return depositRepository.findByStatusOrderByFirstSeenAtAsc(DepositStatus.PENDING);
    }

    // ---------------------------------------------------------------- withdrawals

    public Withdrawal requestWithdrawal(String user, String destChainAddress, BigInteger amount) {
        emergencyStop.ensureNotPaused("requestWithdrawal");
        if (!EvmAddressValidator.isEvmAddress(user)) {
            throw new BridgeException(ErrorCode.INVALID_ADDRESS, "Invalid requester address: " + user);
        }
        if (!addressValidators.resolve(properties.getSourceChain()).isValid(destChainAddress)) {
            throw new BridgeException(
                    ErrorCode.INVALID_ADDRESS,
                    "Invalid " + properties.getSourceChain().name().toLowerCase(Locale.ROOT) + " address: " + destChainAddress
            );
        }
        BigInteger fee = properties.getBridge().getFee();
        if (amount == null || amount.compareTo(fee) <= 0) {
            throw new BridgeException(
                    ErrorCode.INVALID_AMOUNT,
                    BridgeLedger.REASON_AMOUNT_BELOW_FEE,
                    Map.of("fee", fee.toString())
            );
        }

        String requester = user.toLowerCase(Locale.ROOT);
        return withLock(accountLocks, requester, () -> {
            BigInteger available = readWithRetry(() -> ledger.balanceOf(requester));
            if (available.compareTo(amount) < 0) {
                throw BridgeException.insufficientBalance(amount, available);
            }

            Withdrawal withdrawal = withdrawalRepository.save(
                    Withdrawal.requested(requester, destChainAddress, amount, fee, clock.instant()));
            log.info(
                    "event=bridge_relay.withdrawal.requested withdrawalId={} requester={} destChainAddress={} amount={}",
                    withdrawal.getId(),
                    requester,
                    destChainAddress,
                    amount
            );

            LedgerReceipt receipt;
            try {
                receipt = ledger.requestWithdrawal(requester, destChainAddress, amount);
            } catch (LedgerRevertException e) {
                withdrawalRepository.delete(withdrawal);
                throw mapWithdrawalRevert(requester, amount, e);
            }

            withdrawal.markLocked(receipt.txHash(), receipt.amount(), clock.instant());
            Withdrawal saved = withdrawalRepository.save(withdrawal);
            log.info(
                    "event=bridge_relay.withdrawal.locked withdrawalId={} netAmount={} debitTxHash={}",
                    saved.getId(),
                    saved.getNetAmount(),
                    saved.getDebitTxHash()
            );
            return saved;
        });
    }

    // At-least-once: repeating the same payout id is a no-op.
    public Withdrawal confirmPayout(String operator, UUID withdrawalId, String payoutTxId) {
        accessControl.require(Role.RELAYER, operator);
        if (payoutTxId == null || payoutTxId.isBlank()) {
            throw new BridgeException(ErrorCode.INVALID_REQUEST, "payoutTxId is required");
        }
        return withLock(accountLocks, withdrawalId.toString(), () -> {
            Withdrawal withdrawal = loadWithdrawal(withdrawalId);
            if (withdrawal.getStatus() == WithdrawalStatus.PAID && payoutTxId.equals(withdrawal.getPayoutTxId())) {
                log.info("event=bridge_relay.payout.duplicate withdrawalId={} payoutTxId={}", withdrawalId, payoutTxId);
                return withdrawal;
            }
            withdrawal.markPaid(payoutTxId, clock.instant());
            Withdrawal saved = withdrawalRepository.save(withdrawal);
            log.info("event=bridge_relay.payout.confirmed withdrawalId={} payoutTxId={}", withdrawalId, payoutTxId);
            return saved;
        });
    }

    public Withdrawal refundWithdrawal(String admin, UUID withdrawalId, String reason) {
        accessControl.require(Role.ADMIN, admin);
        return withLock(accountLocks, withdrawalId.toString(), () -> {
            Withdrawal withdrawal = loadWithdrawal(withdrawalId);
            if (withdrawal.getStatus() != WithdrawalStatus.LOCKED) {
                throw new BridgeException(
                        ErrorCode.INVALID_STATE,
                        "withdrawal " + withdrawalId + " is " + withdrawal.getStatus() + ", expected LOCKED",
                        Map.of("withdrawalId", withdrawalId.toString(), "status", withdrawal.getStatus().name())
                );
            }
            LedgerReceipt receipt;
            try {
                receipt = ledger.refundWithdrawal(withdrawal.getRequester(), withdrawal.getAmount());
            } catch (LedgerRevertException e) {
                throw invariantViolation("refundWithdrawal", withdrawalId.toString(), e);
            }
            withdrawal.markRefunded(reason, receipt.txHash(), clock.instant());
            Withdrawal saved = withdrawalRepository.save(withdrawal);
            log.warn(
                    "event=bridge_relay.withdrawal.refunded withdrawalId={} requester={} amount={} reason={}",
                    withdrawalId,
                    saved.getRequester(),
                    saved.getAmount(),
                    reason
            );
            return saved;
        });
    }

    public Withdrawal getWithdrawal(UUID withdrawalId) {
        return loadWithdrawal(withdrawalId);
    }

    public List<Withdrawal> listLockedWithdrawals() {
        return withdrawalRepository.findByStatusOrderByCreatedAtAsc(WithdrawalStatus.LOCKED);
    }

    // ---------------------------------------------------------------- internals

    private void validateNewDeposit(NewDeposit request) {
        if (request == null || request.sourceTxId() == null || request.sourceTxId().isBlank()) {
            throw new BridgeException(ErrorCode.INVALID_REQUEST, "sourceTxId is required");
        }
        if (request.sourceAddress() == null || request.sourceAddress().isBlank()) {
            throw new BridgeException(ErrorCode.INVALID_REQUEST, "sourceAddress is required");
        }
        if (!EvmAddressValidator.isEvmAddress(request.destAddress())) {
            throw new BridgeException(ErrorCode.INVALID_ADDRESS, "Invalid destination address: " + request.destAddress());
        }
        RelayProperties.Bridge bridge = properties.getBridge();
        if (request.amount() == null
                || request.amount().compareTo(bridge.getMinDeposit()) < 0
                || request.amount().compareTo(bridge.getMaxDeposit()) > 0) {
            throw new BridgeException(
                    ErrorCode.INVALID_AMOUNT,
                    BridgeLedger.REASON_INVALID_AMOUNT,
                    Map.of("min", bridge.getMinDeposit().toString(), "max", bridge.getMaxDeposit().toString())
            );
        }
    }

    private Deposit validateIdempotentDeposit(Deposit existing, NewDeposit request) {
        if (!existing.sameContent(request.sourceTxId(), request.sourceAddress(), request.destAddress(), request.amount())) {
            log.warn("event=bridge_relay.add_deposit.conflict depositId={} sourceTxId={}", existing.getId(), request.sourceTxId());
            throw new BridgeException(
                    ErrorCode.CONFLICTING_DEPOSIT,
                    "ConflictingDeposit: " + request.sourceTxId() + " already registered with a different payload",
                    Map.of("depositId", existing.getId(), "sourceTxId", request.sourceTxId())
            );
        }
        log.info("event=bridge_relay.add_deposit.idempotent_hit depositId={}", existing.getId());
        return existing;
    }

    private void requireConfirmations(Deposit deposit, long confirmations) {
        int required = properties.getBridge().getRequiredConfirmations();
        if (confirmations < required) {
            throw new BridgeException(
                    ErrorCode.INSUFFICIENT_CONFIRMATIONS,
                    ProcessingResult.INSUFFICIENT_CONFIRMATIONS,
                    Map.of("depositId", deposit.getId(), "confirmations", confirmations, "required", required)
            );
        }
    }

    private BridgeException fail(Deposit deposit, BridgeException error) {
        deposit.markFailed(error.getCode(), error.getMessage(), clock.instant());
        depositRepository.save(deposit);
        log.warn(
                "event=bridge_relay.process.failed depositId={} code={} reason={}",
                deposit.getId(),
                error.getCode(),
                error.getMessage()
        );
        return error;
    }

    private BridgeException mapDepositRevert(String depositId, LedgerRevertException e) {
        String reason = e.getReason() == null ? "" : e.getReason();
        Map<String, Object> details = Map.of("depositId", depositId, "revertReason", reason);
        return switch (reason) {
            case BridgeLedger.REASON_INVALID_AMOUNT -> new BridgeException(ErrorCode.INVALID_AMOUNT, reason, details, e);
            case BridgeLedger.REASON_ALREADY_PROCESSED -> new BridgeException(ErrorCode.ALREADY_PROCESSED, reason, details, e);
            case BridgeLedger.REASON_INVALID_SIGNATURE -> new BridgeException(ErrorCode.INVALID_SIGNATURE, reason, details, e);
            case BridgeLedger.REASON_PAUSED -> new BridgeException(ErrorCode.SYSTEM_PAUSED, reason, details, e);
            default -> invariantViolation("processDeposit", depositId, e);
        };
    }

    private BridgeException mapWithdrawalRevert(String requester, BigInteger amount, LedgerRevertException e) {
        String reason = e.getReason() == null ? "" : e.getReason();
        return switch (reason) {
            case BridgeLedger.REASON_INSUFFICIENT_BALANCE -> BridgeException.insufficientBalance(amount, ledger.balanceOf(requester));
            case BridgeLedger.REASON_AMOUNT_BELOW_FEE -> new BridgeException(ErrorCode.INVALID_AMOUNT, reason, Map.of(), e);
            case BridgeLedger.REASON_PAUSED -> new BridgeException(ErrorCode.SYSTEM_PAUSED, reason, Map.of(), e);
            default -> invariantViolation("requestWithdrawal", requester, e);
        };
    }

    private BridgeException invariantViolation(String operation, String subject, LedgerRevertException e) {
        log.error("event=bridge_relay.invariant_violation operation={} subject={} revertReason={}", operation, subject, e.getReason());
        alertManager.sendAlert(
                "Unexpected ledger revert",
                operation + " for " + subject + " reverted: " + e.getReason(),
                AlertSeverity.CRITICAL
        );
        return new BridgeException(
                ErrorCode.INVARIANT_VIOLATION,
                "Unexpected ledger revert: " + e.getReason(),
                Map.of("operation", operation, "subject", subject),
                e
        );
    }

    private Deposit loadDeposit(String depositId) {
        return depositRepository.findById(depositId)
                .orElseThrow(() -> BridgeException.notFound("deposit", depositId));
    }

    private Withdrawal loadWithdrawal(UUID withdrawalId) {
        return withdrawalRepository.findById(withdrawalId)
                .orElseThrow(() -> BridgeException.notFound("withdrawal", withdrawalId));
    }

    private <T> T readWithRetry(Supplier<T> read) {
        return Retry.decorateSupplier(chainReadRetry, read).get();
    }

    private static <T> T withLock(ConcurrentHashMap<String, ReentrantLock> locks, String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key.toLowerCase(Locale.ROOT), k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
