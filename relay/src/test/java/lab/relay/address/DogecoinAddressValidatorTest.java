package lab.relay.address;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class DogecoinAddressValidatorTest {

    private final DogecoinAddressValidator validator = new DogecoinAddressValidator();

    @ParameterizedTest
    @ValueSource(strings = {
            "DBXu2kgc3xtvCUWFcxFE3r9hEYgmuaaCyD",
            "D597kHXGdkwkryF9oGhz9Bp1ypTpD1u99Z",
            "nUHVMF6vcrGd8RSK2hUZjwuGDNmPeNoBRb"
    })
    void acceptsMainnetAndTestnetAddresses(String address) {
        assertThat(validator.isValid(address)).isTrue();
    }

    @Test
    void rejectsBadChecksum() {
        assertThat(validator.isValid("DBXu2kgc3xtvCUWFcxFE3r9hEYgmuaaCyE")).isFalse();
    }

    @Test
    void rejectsBitcoinVersionByte() {
        assertThat(validator.isValid("1A1zP1eP5QGefi2DMPTfTL5SLmv7DivfNa")).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "DBXu2kgc3xtvCUWFcxFE3r9hEYgmuaaCy0",
            "0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266",
            "D597kHXGdkwk"
    })
    void rejectsMalformedInput(String address) {
        assertThat(validator.isValid(address)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"0OIl", "DBXu2kgc3xtvCUWFcxFE3r9hEYgmuaaCyl", "11"})
    void rejectsNonBase58OrTooShortInput(String address) {
        assertThat(validator.isValid(address)).isFalse();
    }
}
