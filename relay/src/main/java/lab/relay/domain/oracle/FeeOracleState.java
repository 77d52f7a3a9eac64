package lab.relay.domain.oracle;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Singleton row holding the oracle's contract-like globals. Only mutated by {@code FeeOracle}
 * while it holds its lock.
 */
@Entity
@Table(name = "fee_oracle_state")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class FeeOracleState {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger gasPrice;

    @Column(nullable = false)
    private Instant lastUpdatedAt;

    @Column(nullable = false)
    private int feeMultiplier;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger dailyCompensated;

    @Column(nullable = false)
    private Instant lastDailyReset;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger totalCompensated;

    public static FeeOracleState initial(BigInteger gasPrice, int feeMultiplier, Instant now) {
        return FeeOracleState.builder()
                .id(SINGLETON_ID)
                .gasPrice(gasPrice)
                .lastUpdatedAt(now)
                .feeMultiplier(feeMultiplier)
                .dailyCompensated(BigInteger.ZERO)
                .lastDailyReset(now)
                .totalCompensated(BigInteger.ZERO)
                .build();
    }
}
