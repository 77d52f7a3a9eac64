package lab.relay.adapter;

import org.web3j.crypto.RawTransaction;

public interface TransactionSigner {
    String sign(RawTransaction tx, long chainId);
    String getAddress();
}
