package lab.relay.testutil;

import lab.relay.attestation.AttestationMessage;
import lab.relay.attestation.OperatorKeyAttestationSigner;
import lab.relay.config.RelayProperties;

public final class TestSigners {

    private TestSigners() {
    }

    public static String signWith(String privateKey, AttestationMessage message) {
        RelayProperties properties = new RelayProperties();
        properties.getAttestation().setOperatorPrivateKey(privateKey);
        return new OperatorKeyAttestationSigner(properties).sign(message);
    }
}
