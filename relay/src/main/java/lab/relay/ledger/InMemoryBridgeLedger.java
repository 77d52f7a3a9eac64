package lab.relay.ledger;

import lab.relay.attestation.AttestationMessage;
import lab.relay.attestation.AttestationVerifier;
import lab.relay.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process stand-in for the bridge + wrapped-token contracts used in mock mode.
 * Every method is synchronized: like a chain, the ledger applies one call at a time.
 */
@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
@Slf4j
public class InMemoryBridgeLedger implements BridgeLedger {

    private static final String FEE_COLLECTOR = "bridge-fee-collector";

    private final AttestationVerifier attestationVerifier;
    private final BigInteger minDeposit;
    private final BigInteger maxDeposit;
    private final BigInteger fee;

    private final Map<String, BigInteger> balances = new HashMap<>();
    private final Set<String> processedDeposits = new HashSet<>();
    private final AtomicLong txCounter = new AtomicLong();
    private BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryBridgeLedger(AttestationVerifier attestationVerifier, RelayProperties properties) {
        this.attestationVerifier = attestationVerifier;
        this.minDeposit = properties.getBridge().getMinDeposit();
        this.maxDeposit = properties.getBridge().getMaxDeposit();
        this.fee = properties.getBridge().getFee();
    }

    @Override
    public synchronized LedgerReceipt processDeposit(String destAddress, BigInteger amount, String depositId, String signature) {
        if (amount.compareTo(minDeposit) < 0 || amount.compareTo(maxDeposit) > 0) {
            throw new LedgerRevertException(REASON_INVALID_AMOUNT);
        }
        String key = depositId.toLowerCase(Locale.ROOT);
        if (processedDeposits.contains(key)) {
            throw new LedgerRevertException(REASON_ALREADY_PROCESSED);
        }
        if (!attestationVerifier.isAuthorized(new AttestationMessage(destAddress, amount, depositId), signature)) {
            throw new LedgerRevertException(REASON_INVALID_SIGNATURE);
        }

        processedDeposits.add(key);
        credit(destAddress, amount);
        totalSupply = totalSupply.add(amount);
        String txHash = nextTxHash("mint", depositId);
        log.info("event=ledger.mint depositId={} destAddress={} amount={} txHash={}", depositId, destAddress, amount, txHash);
        return new LedgerReceipt(txHash, amount);
    }

    @Override
    public synchronized LedgerReceipt requestWithdrawal(String requester, String destChainAddress, BigInteger amount) {
        if (amount.compareTo(fee) <= 0) {
            throw new LedgerRevertException(REASON_AMOUNT_BELOW_FEE);
        }
        BigInteger balance = balanceOf(requester);
        if (balance.compareTo(amount) < 0) {
            throw new LedgerRevertException(REASON_INSUFFICIENT_BALANCE);
        }

        BigInteger net = amount.subtract(fee);
        balances.put(normalize(requester), balance.subtract(amount));
        credit(FEE_COLLECTOR, fee);
        totalSupply = totalSupply.subtract(net);
        String txHash = nextTxHash("burn", requester + destChainAddress);
        log.info(
                "event=ledger.withdrawal requester={} destChainAddress={} amount={} net={} txHash={}",
                requester,
                destChainAddress,
                amount,
                net,
                txHash
        );
        return new LedgerReceipt(txHash, net);
    }

    @Override
    public synchronized LedgerReceipt refundWithdrawal(String requester, BigInteger amount) {
        BigInteger retainedFee = balanceOf(FEE_COLLECTOR).min(fee);
        BigInteger reminted = amount.subtract(retainedFee);
        balances.put(FEE_COLLECTOR, balanceOf(FEE_COLLECTOR).subtract(retainedFee));
        credit(requester, amount);
        totalSupply = totalSupply.add(reminted);
        String txHash = nextTxHash("refund", requester);
        log.info("event=ledger.refund requester={} amount={} txHash={}", requester, amount, txHash);
        return new LedgerReceipt(txHash, amount);
    }

    @Override
    public synchronized LedgerReceipt transfer(String from, String to, BigInteger amount) {
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            throw new LedgerRevertException(REASON_TRANSFER_EXCEEDS_BALANCE);
        }
        balances.put(normalize(from), balance.subtract(amount));
        credit(to, amount);
        return new LedgerReceipt(nextTxHash("transfer", from + to), amount);
    }

    @Override
    public synchronized BigInteger balanceOf(String account) {
        return balances.getOrDefault(normalize(account), BigInteger.ZERO);
    }

    @Override
    public synchronized boolean isProcessed(String depositId) {
        return processedDeposits.contains(depositId.toLowerCase(Locale.ROOT));
    }

    @Override
    public BigInteger bridgeFee() {
        return fee;
    }

    // Simulation hook: fund an account (fee pool, test users) without a deposit.
    public synchronized void mint(String account, BigInteger amount) {
        credit(account, amount);
        totalSupply = totalSupply.add(amount);
        log.info("event=ledger.sim_mint account={} amount={}", account, amount);
    }

    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    private void credit(String account, BigInteger amount) {
        balances.merge(normalize(account), amount, BigInteger::add);
    }

    private String nextTxHash(String kind, String seed) {
        return Hash.sha3String(kind + ":" + seed + ":" + txCounter.incrementAndGet());
    }

    private static String normalize(String account) {
        return account == null ? "" : account.trim().toLowerCase(Locale.ROOT);
    }
}
