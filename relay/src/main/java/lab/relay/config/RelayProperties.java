package lab.relay.config;

import lab.relay.address.SourceChain;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Core relay settings bound from the {@code relay.*} namespace.
 * Adapter-level settings (RPC urls, keys, proxies) are read with {@code @Value} where they are used.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private String environment = "development";

    // chain the withdrawals pay out on and deposits are observed on
    private SourceChain sourceChain = SourceChain.DOGECOIN;

    private Bridge bridge = new Bridge();
    private Attestation attestation = new Attestation();
    private Monitor monitor = new Monitor();
    private FeeOracle feeOracle = new FeeOracle();
    private RetryPolicy retry = new RetryPolicy();
    private Alert alert = new Alert();
    private Roles roles = new Roles();
    private Api api = new Api();

    @Getter
    @Setter
    public static class Bridge {
        private BigInteger minDeposit = new BigInteger("100000000");
        private BigInteger maxDeposit = new BigInteger("100000000000");
        private BigInteger fee = new BigInteger("10000000");
        private int requiredConfirmations = 6;
        private String contractAddress;
        private String tokenAddress;
    }

    @Getter
    @Setter
    public static class Attestation {
        private String operatorPrivateKey;
        private List<String> signers = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Monitor {
        private boolean pollEnabled = true;
        private Duration pollInterval = Duration.ofSeconds(30);
        private Duration pendingTtl = Duration.ofHours(72);
        private int errorBufferSize = 100;
        private int maxRecentErrors = 10;
        private Duration recentErrorWindow = Duration.ofHours(1);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class FeeOracle {
        private String poolAddress;
        private BigInteger initialGasPrice = new BigInteger("30000000000");
        private BigInteger minGasPrice = new BigInteger("1000000000");
        private BigInteger maxGasPrice = new BigInteger("500000000000");
        private Duration updateInterval = Duration.ofHours(1);
        private int feeMultiplier = 110;
        private BigInteger dailyCap = new BigInteger("10000000000000000000");
        private boolean refreshEnabled = true;
    }

    @Getter
    @Setter
    public static class RetryPolicy {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Alert {
        private String webhookUrl = "";
        private Duration timeout = Duration.ofSeconds(5);
        private int workerThreads = 2;
    }

    @Getter
    @Setter
    public static class Roles {
        private List<String> admins = new ArrayList<>();
        private List<String> relayers = new ArrayList<>();
        private List<String> oracles = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Api {
        // empty: X-Relay-Account is trusted as sent (mock mode only)
        private List<AccountKey> accountKeys = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class AccountKey {
        private String account;
        private String key;
    }
}
