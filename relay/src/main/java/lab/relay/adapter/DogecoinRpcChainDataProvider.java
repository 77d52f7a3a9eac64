package lab.relay.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lab.relay.common.BridgeException;
import lab.relay.common.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source-chain reads against a Dogecoin Core compatible JSON-RPC endpoint
 * ({@code getrawtransaction <txid> true}). Only outputs paying the bridge deposit address count.
 */
@Component
@ConditionalOnProperty(prefix = "relay.chain", name = "mode", havingValue = "rpc")
@Slf4j
public class DogecoinRpcChainDataProvider implements ChainDataProvider {

    private static final BigDecimal KOINU_PER_DOGE = new BigDecimal("100000000");
    private static final int RPC_INVALID_ADDRESS_OR_KEY = -5;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String rpcUrl;
    private final String depositAddress;

    public DogecoinRpcChainDataProvider(
            ObjectMapper objectMapper,
            @Value("${relay.source.rpc-url}") String rpcUrl,
            @Value("${relay.source.deposit-address:}") String depositAddress
    ) {
        this.restClient = RestClient.builder().build();
        this.objectMapper = objectMapper;
        this.rpcUrl = rpcUrl.trim();
        this.depositAddress = depositAddress == null ? "" : depositAddress.trim();
    }

    @Override
    public Optional<ObservedTransaction> getTransaction(String txId) {
        JsonNode root = rpcCall("getrawtransaction", List.of(txId, true));
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            if (error.path("code").asInt() == RPC_INVALID_ADDRESS_OR_KEY) {
                return Optional.empty();
            }
            throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "getrawtransaction failed: " + error);
        }

        JsonNode tx = root.get("result");
        if (tx == null || tx.isNull()) {
            return Optional.empty();
        }
        long confirmations = tx.path("confirmations").asLong(0);
        return Optional.of(new ObservedTransaction(txId, confirmations, paidToDepositAddress(tx), firstInputAddress(tx)));
    }

    private BigInteger paidToDepositAddress(JsonNode tx) {
        BigDecimal total = BigDecimal.ZERO;
        for (JsonNode vout : tx.path("vout")) {
            JsonNode addresses = vout.path("scriptPubKey").path("addresses");
            boolean paysBridge = false;
            for (JsonNode address : addresses) {
                if (address.asText().equals(depositAddress)) {
                    paysBridge = true;
                    break;
                }
            }
            if (paysBridge) {
                total = total.add(vout.path("value").decimalValue());
            }
        }
        return total.multiply(KOINU_PER_DOGE).toBigIntegerExact();
    }

    // Indexing nodes annotate inputs with the spending address; plain nodes leave it empty.
    private static String firstInputAddress(JsonNode tx) {
        JsonNode vin = tx.path("vin");
        if (vin.isArray() && !vin.isEmpty()) {
            return vin.get(0).path("address").asText("");
        }
        return "";
    }

    private JsonNode rpcCall(String method, List<?> params) {
        try {
            String responseBody = restClient.post()
                    .uri(rpcUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of(
                            "jsonrpc", "1.0",
                            "method", method,
                            "params", params,
                            "id", "relay"
                    ))
                    .retrieve()
                    .onStatus(status -> status.value() == 500, (request, response) -> {
                        // Dogecoin Core reports RPC errors with HTTP 500 and a JSON body
                    })
                    .body(String.class);
            return objectMapper.readTree(responseBody);
        } catch (RestClientException e) {
            throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "Source chain RPC " + method + " failed", e);
        } catch (Exception e) {
            throw new BridgeException(ErrorCode.RPC_UNAVAILABLE, "Failed to parse source chain RPC response for " + method, e);
        }
    }
}
