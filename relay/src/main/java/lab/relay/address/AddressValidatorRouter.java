package lab.relay.address;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class AddressValidatorRouter {

    private final Map<SourceChain, DestinationAddressValidator> validatorsByChain;

    // Build the routing table once at startup and fail fast if two validators claim the same chain.
    public AddressValidatorRouter(List<DestinationAddressValidator> validators) {
        this.validatorsByChain = validators.stream()
                .collect(Collectors.toUnmodifiableMap(
                        DestinationAddressValidator::getChain,
                        Function.identity(),
                        (left, right) -> {
                            throw new IllegalStateException("Multiple address validators found for chain: " + left.getChain());
                        }
                ));
    }

    public DestinationAddressValidator resolve(SourceChain chain) {
        return Optional.ofNullable(validatorsByChain.get(chain))
                .orElseThrow(() -> new IllegalArgumentException("No address validator for chain: " + chain));
    }
}
