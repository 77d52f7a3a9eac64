package lab.relay.address;

/**
 * Pure address-format check for one payout chain (checksum and version rules only, no network).
 */
public interface DestinationAddressValidator {

    SourceChain getChain();

    boolean isValid(String address);
}
