package lab.relay.adapter;

import lab.relay.common.BridgeException;
import lab.relay.common.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthGasPrice;

import java.io.IOException;
import java.math.BigInteger;

@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "rpc")
@RequiredArgsConstructor
public class Web3jDestinationChain implements DestinationChain {

    private final Web3j web3j;

    @Override
    public long chainId() {
        try {
            EthChainId response = web3j.ethChainId().send();
            if (response.hasError()) {
                throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "eth_chainId failed: " + response.getError().getMessage());
            }
            return response.getChainId().longValue();
        } catch (IOException e) {
            throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "Failed to fetch chain id", e);
        }
    }

    @Override
    public BigInteger gasPrice() {
        try {
            EthGasPrice response = web3j.ethGasPrice().send();
            if (response.hasError()) {
                throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "eth_gasPrice failed: " + response.getError().getMessage());
            }
            return response.getGasPrice();
        } catch (IOException e) {
            throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "Failed to fetch gas price", e);
        }
    }
}
