package lab.relay.common;

public enum Role {
    ADMIN,
    RELAYER,
    ORACLE;

    public String roleName() {
        return name() + "_ROLE";
    }
}
