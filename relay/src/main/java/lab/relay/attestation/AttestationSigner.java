package lab.relay.attestation;

public interface AttestationSigner {

    // Returns the 65-byte personal-sign signature over the message hash, hex encoded.
    String sign(AttestationMessage message);

    String getAddress();
}
