package lab.relay.adapter;

import jakarta.annotation.PostConstruct;
import lab.relay.address.EvmAddressValidator;
import lab.relay.config.RelayProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "rpc")
@RequiredArgsConstructor
public class RpcModeStartupGuard {

    private final RelayProperties properties;

    @Value("${relay.evm.chain-id}")
    private long chainId;

    @Value("${relay.evm.private-key:}")
    private String privateKey;

    @Value("${relay.evm.rpc-url:}")
    private String rpcUrl;

    @Value("${relay.source.rpc-url:}")
    private String sourceRpcUrl;

    @Value("${relay.evm.allow-mainnet:false}")
    private boolean allowMainnet;

    @PostConstruct
    void validate() {
        if (chainId == 1 && !allowMainnet) {
            throw new IllegalStateException("Mainnet(chain-id=1) requires relay.evm.allow-mainnet=true");
        }
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalStateException("RELAY_EVM_PRIVATE_KEY must be configured in rpc mode");
        }
        if (rpcUrl == null || rpcUrl.isBlank()) {
            throw new IllegalStateException("RELAY_EVM_RPC_URL must be configured in rpc mode");
        }
        if (sourceRpcUrl == null || sourceRpcUrl.isBlank()) {
            throw new IllegalStateException("RELAY_SOURCE_RPC_URL must be configured in rpc mode");
        }
        if (!EvmAddressValidator.isEvmAddress(properties.getBridge().getContractAddress())
                || !EvmAddressValidator.isEvmAddress(properties.getBridge().getTokenAddress())) {
            throw new IllegalStateException("relay.bridge.contract-address and relay.bridge.token-address must be EVM addresses in rpc mode");
        }
        if (properties.getApi().getAccountKeys().isEmpty()) {
            throw new IllegalStateException("relay.api.account-keys must be configured in rpc mode");
        }
    }
}
