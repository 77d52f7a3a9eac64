package lab.relay.attestation;

import lab.relay.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recovers the signer of an attestation with secp256k1 public-key recovery and checks it against
 * the configured allow-list. Nothing else authorizes a mint.
 */
@Component
@Slf4j
public class AttestationVerifier {

    private final Set<String> authorizedSigners;

    public AttestationVerifier(RelayProperties properties) {
        this.authorizedSigners = properties.getAttestation().getSigners().stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        if (authorizedSigners.isEmpty()) {
            log.warn("event=attestation.verifier.empty_allow_list every attestation will be rejected");
        }
    }

    public Optional<String> recoverSigner(AttestationMessage message, String signatureHex) {
        try {
            Sign.SignatureData signature = Signatures.fromHex(signatureHex);
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(message.hash(), signature);
            return Optional.of("0x" + Keys.getAddress(publicKey));
        } catch (SignatureException | RuntimeException e) {
            log.info("event=attestation.recover.failed depositId={} reason={}", message.depositId(), e.getMessage());
            return Optional.empty();
        }
    }

    public boolean isAuthorized(AttestationMessage message, String signatureHex) {
        return recoverSigner(message, signatureHex)
                .map(signer -> authorizedSigners.contains(signer.toLowerCase(Locale.ROOT)))
                .orElse(false);
    }

    public Set<String> getAuthorizedSigners() {
        return authorizedSigners;
    }
}
