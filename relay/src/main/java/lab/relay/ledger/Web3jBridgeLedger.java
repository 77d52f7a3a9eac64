package lab.relay.ledger;

import lab.relay.adapter.TransactionSigner;
import lab.relay.common.BridgeException;
import lab.relay.common.ErrorCode;
import lab.relay.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.RawTransaction;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Bridge and wrapped-token contracts reached through web3j.
 *
 * <p>Every state-changing call is first simulated with {@code eth_call} so contract rejections
 * surface with their revert reason before anything is signed. Submission is serialized on this
 * instance so the operator nonce is read and consumed by one caller at a time.
 */
@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "rpc")
@Slf4j
public class Web3jBridgeLedger implements BridgeLedger {

    private static final BigInteger GAS_LIMIT = BigInteger.valueOf(300_000);
    private static final BigInteger MAX_PRIORITY_FEE_PER_GAS = BigInteger.valueOf(2_000_000_000L);
    private static final int RECEIPT_POLL_ATTEMPTS = 60;
    private static final long RECEIPT_POLL_INTERVAL_SECONDS = 2;

    private final Web3j web3j;
    private final TransactionSigner signer;
    private final long chainId;
    private final String bridgeAddress;
    private final String tokenAddress;

    public Web3jBridgeLedger(
            Web3j web3j,
            TransactionSigner signer,
            RelayProperties properties,
            @Value("${relay.evm.chain-id}") long chainId
    ) {
        this.web3j = web3j;
        this.signer = signer;
        this.chainId = chainId;
        this.bridgeAddress = properties.getBridge().getContractAddress();
        this.tokenAddress = properties.getBridge().getTokenAddress();
    }

    @Override
    public LedgerReceipt processDeposit(String destAddress, BigInteger amount, String depositId, String signature) {
        Function function = new Function(
                "processDeposit",
                List.of(
                        new Address(destAddress),
                        new Uint256(amount),
                        new Bytes32(Numeric.hexStringToByteArray(depositId)),
                        new DynamicBytes(Numeric.hexStringToByteArray(signature))
                ),
                Collections.emptyList()
        );
        String txHash = submit(bridgeAddress, function);
        log.info("event=ledger.rpc.mint depositId={} destAddress={} amount={} txHash={}", depositId, destAddress, amount, txHash);
        return new LedgerReceipt(txHash, amount);
    }

    @Override
    public LedgerReceipt requestWithdrawal(String requester, String destChainAddress, BigInteger amount) {
        requireOperator(requester);
        Function function = new Function(
                "requestWithdrawal",
                List.of(new Utf8String(destChainAddress), new Uint256(amount)),
                Collections.emptyList()
        );
        BigInteger net = amount.subtract(bridgeFee());
        String txHash = submit(bridgeAddress, function);
        log.info("event=ledger.rpc.withdrawal destChainAddress={} amount={} net={} txHash={}", destChainAddress, amount, net, txHash);
        return new LedgerReceipt(txHash, net);
    }

    // The contract has no refund entry point: the operator wallet pays the requester back in wrapped tokens.
    @Override
    public LedgerReceipt refundWithdrawal(String requester, BigInteger amount) {
        return transfer(signer.getAddress(), requester, amount);
    }

    @Override
    public LedgerReceipt transfer(String from, String to, BigInteger amount) {
        requireOperator(from);
        Function function = new Function(
                "transfer",
                List.of(new Address(to), new Uint256(amount)),
                List.of(new TypeReference<Bool>() {})
        );
        String txHash = submit(tokenAddress, function);
        log.info("event=ledger.rpc.transfer to={} amount={} txHash={}", to, amount, txHash);
        return new LedgerReceipt(txHash, amount);
    }

    @Override
    public BigInteger balanceOf(String account) {
        Function function = new Function(
                "balanceOf",
                List.of(new Address(account)),
                List.of(new TypeReference<Uint256>() {})
        );
        return (BigInteger) call(tokenAddress, function);
    }

    @Override
    public boolean isProcessed(String depositId) {
        Function function = new Function(
                "processedDeposits",
                List.of(new Bytes32(Numeric.hexStringToByteArray(depositId))),
                List.of(new TypeReference<Bool>() {})
        );
        return (Boolean) call(bridgeAddress, function);
    }

    @Override
    public BigInteger bridgeFee() {
        Function function = new Function(
                "bridgeFee",
                Collections.emptyList(),
                List.of(new TypeReference<Uint256>() {})
        );
        return (BigInteger) call(bridgeAddress, function);
    }

    private Object call(String contract, Function function) {
        String data = FunctionEncoder.encode(function);
        EthCall response = ethCall(contract, data, function.getName());
        return FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters())
                .stream()
                .findFirst()
                .map(first -> first.getValue())
                .orElseThrow(() -> new BridgeException(ErrorCode.RPC_UNAVAILABLE, "Empty result from " + function.getName()));
    }

    private synchronized String submit(String contract, Function function) {
        String data = FunctionEncoder.encode(function);
        // Surfaces the revert reason without spending gas or a nonce.
        ethCall(contract, data, function.getName());

        try {
            BigInteger nonce = pendingNonce();
            BigInteger maxFeePerGas = web3j.ethGasPrice().send().getGasPrice()
                    .multiply(BigInteger.TWO)
                    .add(MAX_PRIORITY_FEE_PER_GAS);
            RawTransaction rawTransaction = RawTransaction.createTransaction(
                    chainId,
                    nonce,
                    GAS_LIMIT,
                    contract,
                    BigInteger.ZERO,
                    data,
                    MAX_PRIORITY_FEE_PER_GAS,
                    maxFeePerGas
            );
            String signedTxHex = signer.sign(rawTransaction, chainId);

            EthSendTransaction sent = web3j.ethSendRawTransaction(signedTxHex).send();
            if (sent.hasError()) {
                throw new LedgerRevertException(sent.getError().getMessage());
            }
            String txHash = sent.getTransactionHash();
            awaitSuccessfulReceipt(txHash, function.getName());
            return txHash;
        } catch (IOException e) {
            throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "Failed to submit " + function.getName(), e);
        }
    }

    private EthCall ethCall(String contract, String data, String functionName) {
        try {
            EthCall response = web3j.ethCall(
                    Transaction.createEthCallTransaction(signer.getAddress(), contract, data),
                    DefaultBlockParameterName.LATEST
            ).send();
            if (response.isReverted()) {
                throw new LedgerRevertException(response.getRevertReason());
            }
            if (response.hasError()) {
                throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, functionName + " call failed: " + response.getError().getMessage());
            }
            return response;
        } catch (IOException e) {
            throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "Failed to call " + functionName, e);
        }
    }

    private BigInteger pendingNonce() throws IOException {
        EthGetTransactionCount response = web3j.ethGetTransactionCount(signer.getAddress(), DefaultBlockParameterName.PENDING).send();
        if (response.hasError()) {
            throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "Failed to fetch nonce: " + response.getError().getMessage());
        }
        return response.getTransactionCount();
    }

    private void awaitSuccessfulReceipt(String txHash, String functionName) throws IOException {
        try {
            for (int attempt = 0; attempt < RECEIPT_POLL_ATTEMPTS; attempt++) {
                Optional<TransactionReceipt> receipt = web3j.ethGetTransactionReceipt(txHash).send().getTransactionReceipt();
                if (receipt.isPresent()) {
                    if (!receipt.get().isStatusOK()) {
                        throw new LedgerRevertException(functionName + " reverted on chain: " + txHash);
                    }
                    return;
                }
                TimeUnit.SECONDS.sleep(RECEIPT_POLL_INTERVAL_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "Interrupted waiting for receipt of " + txHash, e);
        }
        // Outcome unknown: the transaction may still be mined.
        throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "No receipt for " + functionName + " tx " + txHash);
    }

    private void requireOperator(String account) {
        if (account == null || !account.equalsIgnoreCase(signer.getAddress())) {
            throw new BridgeException(
                    ErrorCode.INVALID_STATE,
                    "Only the operator wallet can move tokens in rpc mode: " + account
            );
        }
    }
}
