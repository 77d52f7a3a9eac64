package lab.relay.attestation;

import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.util.Arrays;

// 65-byte r || s || v encoding used by eth_sign / personal_sign.
final class Signatures {

    private static final int SIGNATURE_LENGTH = 65;

    private Signatures() {
    }

    static String toHex(Sign.SignatureData signature) {
        byte[] encoded = new byte[SIGNATURE_LENGTH];
        System.arraycopy(signature.getR(), 0, encoded, 0, 32);
        System.arraycopy(signature.getS(), 0, encoded, 32, 32);
        encoded[64] = signature.getV()[0];
        return Numeric.toHexString(encoded);
    }

    static Sign.SignatureData fromHex(String signatureHex) {
        if (signatureHex == null || signatureHex.isBlank()) {
            throw new IllegalArgumentException("signature is required");
        }
        byte[] raw = Numeric.hexStringToByteArray(signatureHex);
        if (raw.length != SIGNATURE_LENGTH) {
            throw new IllegalArgumentException("signature must be 65 bytes, got " + raw.length);
        }
        byte v = raw[64];
        if (v < 27) {
            v = (byte) (v + 27);
        }
        return new Sign.SignatureData(v, Arrays.copyOfRange(raw, 0, 32), Arrays.copyOfRange(raw, 32, 64));
    }
}
