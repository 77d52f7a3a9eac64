package lab.relay.oracle;

import io.github.resilience4j.retry.Retry;
import lab.relay.adapter.DestinationChain;
import lab.relay.alert.AlertManager;
import lab.relay.alert.AlertSeverity;
import lab.relay.common.AccessControl;
import lab.relay.common.BridgeException;
import lab.relay.common.EmergencyStop;
import lab.relay.common.ErrorCode;
import lab.relay.config.RelayProperties;
import lab.relay.domain.oracle.FeeOracleState;
import lab.relay.domain.oracle.FeeOracleStateRepository;
import lab.relay.domain.oracle.RelayerAccount;
import lab.relay.domain.oracle.RelayerAccountRepository;
import lab.relay.ledger.BridgeLedger;
import lab.relay.ledger.LedgerRevertException;
import lab.relay.testutil.MutableClock;
import lab.relay.testutil.TestAccounts;
import lab.relay.testutil.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeeOracleAlertingTest {

    private static final BigInteger GWEI = new BigInteger("1000000000");
    private static final BigInteger ACCRUED = new BigInteger("693000000000000");
    private static final String RELAYER = TestAccounts.RELAYER.toLowerCase(Locale.ROOT);

    @Mock FeeOracleStateRepository stateRepository;
    @Mock RelayerAccountRepository relayerAccountRepository;
    @Mock DestinationChain destinationChain;
    @Mock BridgeLedger ledger;
    @Mock AlertManager alertManager;
    @Mock ApplicationEventPublisher eventPublisher;
    @Mock PlatformTransactionManager transactionManager;

    MutableClock clock = new MutableClock(TestClockConfig.START);
    FeeOracle feeOracle;

    @BeforeEach
    void setUp() {
        RelayProperties properties = new RelayProperties();
        properties.getFeeOracle().setPoolAddress(TestAccounts.FEE_POOL);
        feeOracle = new FeeOracle(
                stateRepository,
                relayerAccountRepository,
                destinationChain,
                ledger,
                new AccessControl(properties),
                new EmergencyStop(),
                alertManager,
                eventPublisher,
                Retry.ofDefaults("test"),
                new TransactionTemplate(transactionManager),
                properties,
                clock
        );
    }

    // ---------------------------------------------------------------- gas price alerts

    @Test
    void updateGasPrice_moveAboveThirtyPercent_isAppliedWithWarning() {
        startAtThirtyGwei();
        when(destinationChain.gasPrice()).thenReturn(GWEI.multiply(BigInteger.valueOf(42)));

        assertThat(feeOracle.updateGasPrice().price()).isEqualTo(GWEI.multiply(BigInteger.valueOf(42)));

        verify(alertManager).sendAlert(eq("Large gas price movement"), contains("(40%)"), eq(AlertSeverity.WARNING));
    }

    @Test
    void updateGasPrice_moveOfExactlyThirtyPercent_raisesNoAlert() {
        startAtThirtyGwei();
        when(destinationChain.gasPrice()).thenReturn(GWEI.multiply(BigInteger.valueOf(39)));

        assertThat(feeOracle.updateGasPrice().price()).isEqualTo(GWEI.multiply(BigInteger.valueOf(39)));

        verifyNoInteractions(alertManager);
    }

    // ---------------------------------------------------------------- balance withdrawal

    @Test
    void withdrawBalance_unknownTransferOutcome_leavesBalanceDrainedAndAlerts() {
        RelayerAccount account = accountWithAccruedBalance();
        when(ledger.balanceOf(TestAccounts.FEE_POOL)).thenReturn(ACCRUED);
        when(ledger.transfer(TestAccounts.FEE_POOL, RELAYER, ACCRUED))
                .thenThrow(new BridgeException(ErrorCode.RPC_UNAVAILABLE, "No receipt for transfer tx 0xabc"));

        assertThatThrownBy(() -> feeOracle.withdrawBalance(TestAccounts.RELAYER))
                .isInstanceOf(BridgeException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.RPC_UNAVAILABLE);

        assertThat(account.getAccruedBalance()).isZero();
        verify(alertManager).sendAlert(eq("Relayer payout outcome unknown"), anyString(), eq(AlertSeverity.CRITICAL));

        assertThatThrownBy(() -> feeOracle.withdrawBalance(TestAccounts.RELAYER))
                .isInstanceOf(BridgeException.class)
                .hasMessage("InsufficientBalance(0, 0)");
        verify(ledger, times(1)).transfer(TestAccounts.FEE_POOL, RELAYER, ACCRUED);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void withdrawBalance_transferReverted_restoresBalance() {
        RelayerAccount account = accountWithAccruedBalance();
        when(ledger.balanceOf(TestAccounts.FEE_POOL)).thenReturn(ACCRUED);
        when(ledger.transfer(TestAccounts.FEE_POOL, RELAYER, ACCRUED))
                .thenThrow(new LedgerRevertException("ERC20: transfer amount exceeds balance"));

        assertThatThrownBy(() -> feeOracle.withdrawBalance(TestAccounts.RELAYER))
                .isInstanceOf(BridgeException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.TRANSFER_FAILED);

        assertThat(account.getAccruedBalance()).isEqualTo(ACCRUED);
        verify(alertManager).sendAlert(eq("Fee pool transfer failed"), anyString(), eq(AlertSeverity.CRITICAL));
        verify(alertManager, never()).sendAlert(eq("Relayer payout outcome unknown"), anyString(), any());
    }

    private void startAtThirtyGwei() {
        FeeOracleState state = FeeOracleState.initial(GWEI.multiply(BigInteger.valueOf(30)), 110, clock.instant());
        when(stateRepository.findById(FeeOracleState.SINGLETON_ID)).thenReturn(Optional.of(state));
        when(stateRepository.save(any(FeeOracleState.class))).thenAnswer(invocation -> invocation.getArgument(0));
        feeOracle.init();
        clock.advance(Duration.ofHours(1));
    }

    private RelayerAccount accountWithAccruedBalance() {
        RelayerAccount account = RelayerAccount.open(RELAYER, clock.instant());
        account.credit(ACCRUED, false, clock.instant());
        when(relayerAccountRepository.findById(RELAYER)).thenReturn(Optional.of(account));
        when(relayerAccountRepository.save(any(RelayerAccount.class))).thenAnswer(invocation -> invocation.getArgument(0));
        return account;
    }
}
