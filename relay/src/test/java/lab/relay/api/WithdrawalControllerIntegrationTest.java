package lab.relay.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import lab.relay.testutil.TestAccounts;
import lab.relay.testutil.TestClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class WithdrawalControllerIntegrationTest {

    private static final String ACCOUNT_HEADER = "X-Relay-Account";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void withdrawalFlow_lockThenConfirmPayout() throws Exception {
        String account = fundedAccount("300000000");

        String withdrawalId = createWithdrawal(account, "200000000");

        mockMvc.perform(get("/sim/ledger/balance/{account}", account))
                .andExpect(jsonPath("$.data.balance").value(100000000));
        mockMvc.perform(get("/api/v1/withdrawals/locked"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[?(@.id == '%s')]".formatted(withdrawalId)).exists());

        mockMvc.perform(post("/api/v1/withdrawals/{id}/payout", withdrawalId)
                        .header(ACCOUNT_HEADER, TestAccounts.OUTSIDER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payoutTxId\": \"doge-payout-1\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/v1/withdrawals/{id}/payout", withdrawalId)
                            .header(ACCOUNT_HEADER, TestAccounts.RELAYER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"payoutTxId\": \"doge-payout-1\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.status").value("PAID"))
                    .andExpect(jsonPath("$.data.payoutTxId").value("doge-payout-1"));
        }

        mockMvc.perform(post("/api/v1/withdrawals/{id}/refund", withdrawalId)
                        .header(ACCOUNT_HEADER, TestAccounts.OPERATOR))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("INVALID_STATE"));
    }

    @Test
    void refund_restoresBalanceWithDefaultReason() throws Exception {
        String account = fundedAccount("100000000");
        String withdrawalId = createWithdrawal(account, "100000000");

        mockMvc.perform(post("/api/v1/withdrawals/{id}/refund", withdrawalId)
                        .header(ACCOUNT_HEADER, TestAccounts.OPERATOR))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("REFUNDED"))
                .andExpect(jsonPath("$.data.refundReason").value("payout failed"));

        mockMvc.perform(get("/sim/ledger/balance/{account}", account))
                .andExpect(jsonPath("$.data.balance").value(100000000));
    }

    @Test
    void create_withoutAccountHeader_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/withdrawals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(withdrawalBody("100000000")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
    }

    @Test
    void create_overBalance_isConflict() throws Exception {
        String account = fundedAccount("100000000");

        mockMvc.perform(post("/api/v1/withdrawals")
                        .header(ACCOUNT_HEADER, account)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(withdrawalBody("500000000")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("INSUFFICIENT_BALANCE"))
                .andExpect(jsonPath("$.error.message").value("InsufficientBalance(500000000, 100000000)"));
    }

    @Test
    void get_unknownWithdrawal_isNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/withdrawals/{id}", "00000000-0000-0000-0000-000000000000"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/withdrawals/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    private String fundedAccount(String amount) throws Exception {
        String account = TestAccounts.freshAccount();
        mockMvc.perform(post("/sim/ledger/mint")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"account\": \"%s\", \"amount\": %s}".formatted(account, amount)))
                .andExpect(status().isOk());
        return account;
    }

    private String createWithdrawal(String account, String amount) throws Exception {
        String response = mockMvc.perform(post("/api/v1/withdrawals")
                        .header(ACCOUNT_HEADER, account)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(withdrawalBody(amount)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("LOCKED"))
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).at("/data/id").asText();
    }

    private static String withdrawalBody(String amount) {
        return """
                {"destChainAddress": "%s", "amount": %s}
                """.formatted(TestAccounts.DOGE_ADDRESS, amount);
    }
}
