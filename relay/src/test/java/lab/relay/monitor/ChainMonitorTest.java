package lab.relay.monitor;

import lab.relay.adapter.InMemoryChainDataProvider;
import lab.relay.adapter.SimulatedDestinationChain;
import lab.relay.alert.Alert;
import lab.relay.alert.AlertSeverity;
import lab.relay.common.BridgeException;
import lab.relay.common.ErrorCode;
import lab.relay.domain.deposit.Deposit;
import lab.relay.domain.deposit.DepositStatus;
import lab.relay.ledger.InMemoryBridgeLedger;
import lab.relay.orchestration.BridgeRelay;
import lab.relay.orchestration.ProcessingResult;
import lab.relay.testutil.MutableClock;
import lab.relay.testutil.TestAccounts;
import lab.relay.testutil.TestClockConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigInteger;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class ChainMonitorTest {

    private static final BigInteger ONE_COIN = new BigInteger("100000000");
    private static final BigInteger DEFAULT_GAS_PRICE = new BigInteger("30000000000");

    @Autowired
    private ChainMonitor chainMonitor;

    @Autowired
    private BridgeRelay bridgeRelay;

    @Autowired
    private InMemoryChainDataProvider sourceChain;

    @Autowired
    private SimulatedDestinationChain destinationChain;

    @Autowired
    private InMemoryBridgeLedger ledger;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void resetChains() {
        destinationChain.setGasPrice(DEFAULT_GAS_PRICE);
        destinationChain.failNextReads(0);
    }

    @AfterEach
    void restoreGasPrice() {
        destinationChain.setGasPrice(DEFAULT_GAS_PRICE);
    }

    @Test
    void processTransaction_waitsForRequiredConfirmationsThenMints() {
        String txId = TestAccounts.freshTxId();
        String dest = TestAccounts.freshAccount();
        chainMonitor.addDepositInfo(txId, new DepositInfo(TestAccounts.DOGE_ADDRESS, dest, ONE_COIN));
        sourceChain.record(txId, ONE_COIN, TestAccounts.DOGE_ADDRESS, 2);

        ProcessingResult waiting = chainMonitor.processTransaction(txId);

        assertThat(waiting.success()).isFalse();
        assertThat(waiting.error()).isEqualTo("Insufficient confirmations");
        assertThat(waiting.confirmations()).isEqualTo(2);
        assertThat(waiting.status()).isEqualTo(DepositStatus.PENDING);
        assertThat(ledger.balanceOf(dest)).isZero();

        sourceChain.setConfirmations(txId, 6);
        ProcessingResult done = chainMonitor.processTransaction(txId);

        assertThat(done.success()).isTrue();
        assertThat(done.status()).isEqualTo(DepositStatus.COMPLETED);
        assertThat(done.confirmations()).isEqualTo(6);
        assertThat(ledger.balanceOf(dest)).isEqualTo(ONE_COIN);
    }

    @Test
    void processTransaction_afterCompletion_returnsAlreadyProcessedResult() {
        String txId = TestAccounts.freshTxId();
        chainMonitor.addDepositInfo(txId, new DepositInfo(TestAccounts.DOGE_ADDRESS, TestAccounts.freshAccount(), ONE_COIN));
        sourceChain.record(txId, ONE_COIN, TestAccounts.DOGE_ADDRESS, 10);
        assertThat(chainMonitor.processTransaction(txId).success()).isTrue();

        ProcessingResult replay = chainMonitor.processTransaction(txId);

        assertThat(replay.success()).isFalse();
        assertThat(replay.errorCode()).isEqualTo(ErrorCode.ALREADY_PROCESSED);
        assertThat(replay.status()).isEqualTo(DepositStatus.COMPLETED);
    }

    @Test
    void processTransaction_registeredAmountAboveSourcePayment_failsWithoutMint() {
        String txId = TestAccounts.freshTxId();
        String dest = TestAccounts.freshAccount();
        BigInteger claimed = ONE_COIN.multiply(BigInteger.valueOf(500));
        chainMonitor.addDepositInfo(txId, new DepositInfo(TestAccounts.DOGE_ADDRESS, dest, claimed));
        sourceChain.record(txId, ONE_COIN, TestAccounts.DOGE_ADDRESS, 6);

        ProcessingResult result = chainMonitor.processTransaction(txId);

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.SOURCE_TX_MISMATCH);
        assertThat(result.status()).isEqualTo(DepositStatus.FAILED);
        assertThat(ledger.balanceOf(dest)).isZero();
        assertThat(chainMonitor.getLastAlert())
                .get()
                .satisfies(alert -> {
                    assertThat(alert.severity()).isEqualTo(AlertSeverity.CRITICAL);
                    assertThat(alert.message()).contains("does not pay the registered amount");
                });

        ProcessingResult retried = chainMonitor.processTransaction(txId);

        assertThat(retried.errorCode()).isEqualTo(ErrorCode.SOURCE_TX_MISMATCH);
        assertThat(ledger.balanceOf(dest)).isZero();
    }

    @Test
    void processTransaction_senderDiffersFromRegistration_failsWithoutMint() {
        String txId = TestAccounts.freshTxId();
        String dest = TestAccounts.freshAccount();
        chainMonitor.addDepositInfo(txId, new DepositInfo(TestAccounts.DOGE_ADDRESS, dest, ONE_COIN));
        sourceChain.record(txId, ONE_COIN, "D597kHXGdkwkryF9oGhz9Bp1ypTpD1u99Z", 6);

        ProcessingResult result = chainMonitor.processTransaction(txId);

        assertThat(result.errorCode()).isEqualTo(ErrorCode.SOURCE_TX_MISMATCH);
        assertThat(result.error()).contains("does not pay the registered sender");
        assertThat(ledger.balanceOf(dest)).isZero();
    }

    @Test
    void processTransaction_unknownTx_isNotFound() {
        assertThatThrownBy(() -> chainMonitor.processTransaction("doge-never-registered"))
                .isInstanceOf(BridgeException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void processTransaction_txMissingFromSourceChain_countsAsZeroConfirmations() {
        String txId = TestAccounts.freshTxId();
        chainMonitor.addDepositInfo(txId, new DepositInfo(TestAccounts.DOGE_ADDRESS, TestAccounts.freshAccount(), ONE_COIN));

        ProcessingResult result = chainMonitor.processTransaction(txId);

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.INSUFFICIENT_CONFIRMATIONS);
        assertThat(result.confirmations()).isZero();
    }

    @Test
    void recordError_criticalSetsLastAlertAndAppendsToRing() {
        chainMonitor.recordError(new IllegalStateException("ledger invariant broken"), AlertSeverity.CRITICAL);

        assertThat(chainMonitor.getLastAlert()).hasValueSatisfying(alert -> {
            assertThat(alert.severity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(alert.message()).contains("ledger invariant broken");
            assertThat(alert.environment()).isEqualTo("test");
        });
        assertThat(chainMonitor.getHealthStatus().errors())
                .extracting(HealthRecord.ErrorEntry::message)
                .contains("ledger invariant broken");
    }

    @Test
    void recordError_nonCriticalDoesNotReplaceLastAlert() {
        chainMonitor.recordError(new IllegalStateException("first critical"), AlertSeverity.CRITICAL);
        Alert critical = chainMonitor.getLastAlert().orElseThrow();

        chainMonitor.recordError(new IllegalArgumentException("just a warning"), AlertSeverity.WARNING);
        chainMonitor.recordError(null, null);

        assertThat(chainMonitor.getLastAlert()).contains(critical);
    }

    @Test
    void healthStatus_flagsGasPriceOutsideBounds() {
        clock.advance(Duration.ofHours(2));

        HealthStatus healthy = chainMonitor.getHealthStatus();
        assertThat(healthy.isHealthy()).isTrue();
        assertThat(healthy.checks()).containsKeys("provider", "gasPrice", "recentErrors", "contract.bridge");

        destinationChain.setGasPrice(new BigInteger("600000000000"));
        HealthStatus unhealthy = chainMonitor.getHealthStatus();

        assertThat(unhealthy.status()).isEqualTo(HealthStatus.Status.UNHEALTHY);
        assertThat(unhealthy.failingChecks()).containsExactly("gasPrice");
    }

    @Test
    void healthStatus_unreachableDestinationIsUnhealthy() {
        clock.advance(Duration.ofHours(2));
        destinationChain.failNextReads(1);

        HealthStatus health = chainMonitor.getHealthStatus();

        assertThat(health.failingChecks()).containsExactly("gasPrice");
        assertThat(health.checks().get("gasPrice").detail()).startsWith("unavailable");
    }

    @Test
    void healthStatus_tooManyRecentErrorsIsUnhealthyUntilTheyAge() {
        clock.advance(Duration.ofHours(2));
        for (int i = 0; i < 11; i++) {
            chainMonitor.recordError(new IllegalStateException("burst-" + i), AlertSeverity.WARNING);
        }

        assertThat(chainMonitor.getHealthStatus().failingChecks()).contains("recentErrors");

        clock.advance(Duration.ofHours(2));
        assertThat(chainMonitor.getHealthStatus().failingChecks()).doesNotContain("recentErrors");
    }

    @Test
    void runCycle_expiresDepositsPendingPastTtl() {
        String staleTx = TestAccounts.freshTxId();
        Deposit stale = chainMonitor.addDepositInfo(staleTx, new DepositInfo(TestAccounts.DOGE_ADDRESS, TestAccounts.freshAccount(), ONE_COIN));
        clock.advance(Duration.ofHours(73));

        String freshTx = TestAccounts.freshTxId();
        String freshDest = TestAccounts.freshAccount();
        Deposit fresh = chainMonitor.addDepositInfo(freshTx, new DepositInfo(TestAccounts.DOGE_ADDRESS, freshDest, ONE_COIN));
        sourceChain.record(freshTx, ONE_COIN, TestAccounts.DOGE_ADDRESS, 6);

        int examined = chainMonitor.runCycle();

        assertThat(examined).isGreaterThanOrEqualTo(2);
        Deposit expired = bridgeRelay.getDeposit(stale.getId());
        assertThat(expired.getStatus()).isEqualTo(DepositStatus.FAILED);
        assertThat(expired.getFailureCode()).isEqualTo(ErrorCode.DEPOSIT_EXPIRED);
        assertThat(bridgeRelay.getDeposit(fresh.getId()).getStatus()).isEqualTo(DepositStatus.COMPLETED);
        assertThat(ledger.balanceOf(freshDest)).isEqualTo(ONE_COIN);
    }
}
