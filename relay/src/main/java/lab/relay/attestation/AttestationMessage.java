package lab.relay.attestation;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;

/**
 * The exact tuple a mint attestation covers. The bridge contract rebuilds the same hash
 * ({@code keccak256(abi.encode(dest, amount, id))}) and checks the personal-sign signature over it.
 */
public record AttestationMessage(
        String destAddress,
        BigInteger amount,
        String depositId
) {

    public AttestationMessage {
        if (!DepositIds.isWellFormed(depositId)) {
            throw new IllegalArgumentException("deposit id must be a 32-byte hex value: " + depositId);
        }
    }

    public byte[] hash() {
        String encoded = FunctionEncoder.encodeConstructor(List.of(
                new Address(destAddress),
                new Uint256(amount),
                new Bytes32(Numeric.hexStringToByteArray(depositId))
        ));
        return Hash.sha3(Numeric.hexStringToByteArray(encoded));
    }
}
