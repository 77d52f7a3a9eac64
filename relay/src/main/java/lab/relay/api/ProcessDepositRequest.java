package lab.relay.api;

// Optional body of the process call: an attestation issued by an external signer.
public record ProcessDepositRequest(
        String attestationSignature
) {}
