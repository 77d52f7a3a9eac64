package lab.relay.address;

public enum SourceChain {
    DOGECOIN,
    EVM
}
