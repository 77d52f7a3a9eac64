package lab.relay.domain.oracle;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

@Entity
@Table(name = "relayer_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class RelayerAccount {

    // lower-cased EVM address
    @Id
    @Column(length = 42)
    private String address;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger accruedBalance;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger dailyCompensated;

    @Column(nullable = false)
    private Instant lastDailyReset;

    public static RelayerAccount open(String address, Instant now) {
        return RelayerAccount.builder()
                .address(address)
                .accruedBalance(BigInteger.ZERO)
                .dailyCompensated(BigInteger.ZERO)
                .lastDailyReset(now)
                .build();
    }

    public void credit(BigInteger compensation, boolean resetWindow, Instant now) {
        if (resetWindow) {
            this.dailyCompensated = BigInteger.ZERO;
            this.lastDailyReset = now;
        }
        this.dailyCompensated = this.dailyCompensated.add(compensation);
        this.accruedBalance = this.accruedBalance.add(compensation);
    }

    // Returns the withdrawn amount; the balance only ever drops to zero.
    public BigInteger drain() {
        BigInteger withdrawn = accruedBalance;
        this.accruedBalance = BigInteger.ZERO;
        return withdrawn;
    }

    // Puts back a drained amount whose payout was rejected; daily stats are untouched.
    public void restore(BigInteger amount) {
        this.accruedBalance = this.accruedBalance.add(amount);
    }
}
