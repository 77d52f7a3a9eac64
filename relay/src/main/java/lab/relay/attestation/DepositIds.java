package lab.relay.attestation;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.List;
import java.util.regex.Pattern;

public final class DepositIds {

    private static final Pattern DEPOSIT_ID_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{64}$");

    private DepositIds() {
    }

    // keccak256(abi.encode(address dest, uint256 amount, string sourceTxId)); the source tx id is the nonce.
    public static String derive(String destAddress, BigInteger amount, String sourceTxId) {
        return Hash.sha3(FunctionEncoder.encodeConstructor(List.of(
                new Address(destAddress),
                new Uint256(amount),
                new Utf8String(sourceTxId)
        )));
    }

    public static boolean isWellFormed(String depositId) {
        return depositId != null && DEPOSIT_ID_PATTERN.matcher(depositId).matches();
    }
}
