package lab.relay.adapter;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

// Operator wallet that pays gas for relay submissions in rpc mode.
@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "rpc")
public class EvmTransactionSigner implements TransactionSigner {

    private final Credentials credentials;

    public EvmTransactionSigner(@Value("${relay.evm.private-key:}") String privateKey) {
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalStateException("relay.evm.private-key must be configured when relay.chain.mode=rpc");
        }
        this.credentials = Credentials.create(privateKey.trim());
    }

    @Override
    public String sign(RawTransaction tx, long chainId) {
        byte[] signed = TransactionEncoder.signMessage(tx, chainId, credentials);
        return Numeric.toHexString(signed);
    }

    @Override
    public String getAddress() {
        return credentials.getAddress();
    }
}
