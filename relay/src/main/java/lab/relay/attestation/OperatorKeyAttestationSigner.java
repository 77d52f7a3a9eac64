package lab.relay.attestation;

import lab.relay.config.RelayProperties;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Sign;

@Component
public class OperatorKeyAttestationSigner implements AttestationSigner {

    private final Credentials credentials;

    public OperatorKeyAttestationSigner(RelayProperties properties) {
        String privateKey = properties.getAttestation().getOperatorPrivateKey();
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalStateException("relay.attestation.operator-private-key must be configured");
        }
        this.credentials = Credentials.create(privateKey.trim());
    }

    @Override
    public String sign(AttestationMessage message) {
        Sign.SignatureData signature = Sign.signPrefixedMessage(message.hash(), credentials.getEcKeyPair());
        return Signatures.toHex(signature);
    }

    @Override
    public String getAddress() {
        return credentials.getAddress();
    }
}
