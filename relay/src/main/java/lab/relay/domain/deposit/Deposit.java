package lab.relay.domain.deposit;

import jakarta.persistence.*;
import lab.relay.common.BridgeException;
import lab.relay.common.ErrorCode;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "deposits",
       indexes = {
           @Index(name = "idx_deposit_source_tx", columnList = "sourceTxId", unique = true),
           @Index(name = "idx_deposit_status", columnList = "status")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Deposit {

    // keccak256(abi.encode(dest, amount, sourceTxId)), 0x-prefixed
    @Id
    @Column(length = 66)
    private String id;

    @Column(nullable = false, updatable = false, length = 128)
    private String sourceTxId;

    @Column(nullable = false, updatable = false, length = 64)
    private String sourceAddress;

    @Column(nullable = false, updatable = false, length = 42)
    private String destAddress;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(nullable = false)
    private long confirmations;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DepositStatus status;

    @Column(nullable = false, updatable = false)
    private Instant firstSeenAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Column(length = 132)
    private String attestationSignature;

    @Column(length = 66)
    private String mintTxHash;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private ErrorCode failureCode;

    @Column(length = 512)
    private String failureReason;

    public static Deposit pending(
            String id,
            String sourceTxId,
            String sourceAddress,
            String destAddress,
            BigInteger amount,
            Instant now) {
        return Deposit.builder()
                .id(id)
                .sourceTxId(sourceTxId)
                .sourceAddress(sourceAddress)
                .destAddress(destAddress)
                .amount(amount)
                .confirmations(0)
                .status(DepositStatus.PENDING)
                .firstSeenAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean sameContent(String sourceTxId, String sourceAddress, String destAddress, BigInteger amount) {
        return this.sourceTxId.equals(sourceTxId)
                && this.sourceAddress.equals(sourceAddress)
                && this.destAddress.equalsIgnoreCase(destAddress)
                && this.amount.compareTo(amount) == 0;
    }

    // Confirmation depth is only tracked before processing.
    public void recordConfirmations(long observed, Instant now) {
        requireStatus(DepositStatus.PENDING, DepositStatus.CONFIRMED);
        this.confirmations = observed;
        this.updatedAt = now;
    }

    public void markConfirmed(long observed, Instant now) {
        requireStatus(DepositStatus.PENDING, DepositStatus.CONFIRMED);
        this.confirmations = observed;
        this.status = DepositStatus.CONFIRMED;
        this.updatedAt = now;
    }

    public void markCompleted(String attestationSignature, String mintTxHash, Instant now) {
        requireStatus(DepositStatus.CONFIRMED);
        this.attestationSignature = attestationSignature;
        this.mintTxHash = mintTxHash;
        this.status = DepositStatus.COMPLETED;
        this.updatedAt = now;
    }

    public void markFailed(ErrorCode code, String reason, Instant now) {
        requireStatus(DepositStatus.PENDING, DepositStatus.CONFIRMED);
        this.failureCode = code;
        this.failureReason = reason == null || reason.length() <= 512 ? reason : reason.substring(0, 512);
        this.status = DepositStatus.FAILED;
        this.updatedAt = now;
    }

    private void requireStatus(DepositStatus... allowed) {
        for (DepositStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new BridgeException(
                ErrorCode.INVALID_STATE,
                "deposit " + id + " is " + status,
                Map.of("depositId", id, "status", status.name())
        );
    }
}
