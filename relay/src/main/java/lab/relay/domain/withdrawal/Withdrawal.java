package lab.relay.domain.withdrawal;

import jakarta.persistence.*;
import lab.relay.common.BridgeException;
import lab.relay.common.ErrorCode;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "withdrawals",
       indexes = {
           @Index(name = "idx_withdrawal_status", columnList = "status")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Withdrawal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 42)
    private String requester;

    @Column(nullable = false, updatable = false, length = 64)
    private String destSourceChainAddress;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger fee;

    @Column(precision = 78, scale = 0)
    private BigInteger netAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WithdrawalStatus status;

    @Column(length = 66)
    private String debitTxHash;

    @Column(length = 128)
    private String payoutTxId;

    @Column(length = 66)
    private String refundTxHash;

    @Column(length = 512)
    private String refundReason;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static Withdrawal requested(String requester, String destSourceChainAddress, BigInteger amount, BigInteger fee, Instant now) {
        return Withdrawal.builder()
                .requester(requester)
                .destSourceChainAddress(destSourceChainAddress)
                .amount(amount)
                .fee(fee)
                .status(WithdrawalStatus.REQUESTED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void markLocked(String debitTxHash, BigInteger netAmount, Instant now) {
        requireStatus(WithdrawalStatus.REQUESTED);
        this.debitTxHash = debitTxHash;
        this.netAmount = netAmount;
        this.status = WithdrawalStatus.LOCKED;
        this.updatedAt = now;
    }

    public void markPaid(String payoutTxId, Instant now) {
        requireStatus(WithdrawalStatus.LOCKED);
        this.payoutTxId = payoutTxId;
        this.status = WithdrawalStatus.PAID;
        this.updatedAt = now;
    }

    public void markRefunded(String reason, String refundTxHash, Instant now) {
        requireStatus(WithdrawalStatus.LOCKED);
        this.refundReason = reason;
        this.refundTxHash = refundTxHash;
        this.status = WithdrawalStatus.REFUNDED;
        this.updatedAt = now;
    }

    private void requireStatus(WithdrawalStatus expected) {
        if (status != expected) {
            throw new BridgeException(
                    ErrorCode.INVALID_STATE,
                    "withdrawal " + id + " is " + status + ", expected " + expected,
                    Map.of("withdrawalId", String.valueOf(id), "status", status.name())
            );
        }
    }
}
