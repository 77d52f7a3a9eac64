package lab.relay.address;

import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;

import java.util.Locale;

/**
 * 20-byte hex addresses; mixed-case input must match its EIP-55 checksum.
 */
@Component
public class EvmAddressValidator implements DestinationAddressValidator {

    @Override
    public SourceChain getChain() {
        return SourceChain.EVM;
    }

    @Override
    public boolean isValid(String address) {
        if (address == null || !address.startsWith("0x") || !WalletUtils.isValidAddress(address)) {
            return false;
        }
        String hex = address.substring(2);
        boolean singleCase = hex.equals(hex.toLowerCase(Locale.ROOT)) || hex.equals(hex.toUpperCase(Locale.ROOT));
        return singleCase || Keys.toChecksumAddress(address).equals(address);
    }

    public static boolean isEvmAddress(String address) {
        return address != null && address.startsWith("0x") && WalletUtils.isValidAddress(address);
    }
}
