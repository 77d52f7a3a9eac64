package lab.relay.address;

import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Base58Check validation for Dogecoin P2PKH / P2SH addresses (mainnet and testnet version bytes).
 */
@Component
public class DogecoinAddressValidator implements DestinationAddressValidator {

    // version byte + 20-byte hash160, checksum already stripped
    private static final int PAYLOAD_LENGTH = 21;

    // 0x1e = D..., 0x16 = 9/A..., 0x71 = n..., 0xc4 = 2...
    private static final Set<Integer> VERSION_BYTES = Set.of(0x1e, 0x16, 0x71, 0xc4);

    @Override
    public SourceChain getChain() {
        return SourceChain.DOGECOIN;
    }

    @Override
    public boolean isValid(String address) {
        if (address == null || address.isBlank()) {
            return false;
        }
        byte[] payload;
        try {
            payload = Base58.decodeChecked(address);
        } catch (AddressFormatException e) {
            return false;
        }
        return payload.length == PAYLOAD_LENGTH && VERSION_BYTES.contains(payload[0] & 0xff);
    }
}
