package lab.relay.testutil;

import java.util.UUID;

// Well-known local development accounts wired into application.yml.
public final class TestAccounts {

    public static final String OPERATOR = "0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266";
    public static final String OPERATOR_KEY = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    public static final String RELAYER = "0x70997970C51812dc3A010C7d01b50e0d17dc79C8";
    public static final String USER = "0x3C44CdDdB6a900fa2b585dd299e03d12FA4293BC";
    // hardhat account #3, not in any role or signer list
    public static final String OUTSIDER_KEY = "0x7c852118294e51e653712a81e05800f419141751be58f605c371e15141b007a6";
    public static final String OUTSIDER = "0x90F79bf6EB2c4f870365E785982E1f101E93b906";
    public static final String FEE_POOL = "0x9fE46736679d2D9a65F0992F2272dE9f3c7fa6e0";
    public static final String DOGE_ADDRESS = "DBXu2kgc3xtvCUWFcxFE3r9hEYgmuaaCyD";

    private TestAccounts() {
    }

    // Fresh lower-case address so balances never leak between tests sharing one context.
    public static String freshAccount() {
        String hex = UUID.randomUUID().toString().replace("-", "") + UUID.randomUUID().toString().replace("-", "");
        return "0x" + hex.substring(0, 40);
    }

    public static String freshTxId() {
        return "doge-" + UUID.randomUUID();
    }
}
