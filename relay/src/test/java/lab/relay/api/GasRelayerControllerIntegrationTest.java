package lab.relay.api;

import lab.relay.adapter.SimulatedDestinationChain;
import lab.relay.domain.oracle.FeeOracleStateRepository;
import lab.relay.domain.oracle.RelayerAccountRepository;
import lab.relay.oracle.FeeOracle;
import lab.relay.testutil.MutableClock;
import lab.relay.testutil.TestAccounts;
import lab.relay.testutil.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigInteger;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class GasRelayerControllerIntegrationTest {

    private static final String ACCOUNT_HEADER = "X-Relay-Account";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private FeeOracle feeOracle;

    @Autowired
    private FeeOracleStateRepository stateRepository;

    @Autowired
    private RelayerAccountRepository relayerAccountRepository;

    @Autowired
    private SimulatedDestinationChain destinationChain;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void resetOracle() {
        clock.setInstant(TestClockConfig.START);
        destinationChain.setGasPrice(new BigInteger("30000000000"));
        stateRepository.deleteAll();
        relayerAccountRepository.deleteAll();
        feeOracle.init();
    }

    @Test
    void estimate_returnsQuoteBreakdown() throws Exception {
        mockMvc.perform(get("/api/v1/gas-relayer/estimate").param("gasLimit", "21000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.gasLimit").value(21000))
                .andExpect(jsonPath("$.data.gasPrice").value(30000000000L))
                .andExpect(jsonPath("$.data.feeMultiplier").value(110))
                .andExpect(jsonPath("$.data.estimatedFee").value(693000000000000L));
    }

    @Test
    void estimate_invalidGasLimit_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/gas-relayer/estimate").param("gasLimit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_GAS_LIMIT"));
        mockMvc.perform(get("/api/v1/gas-relayer/estimate"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_REQUEST"));
    }

    @Test
    void compensateThenQueryBalance() throws Exception {
        mockMvc.perform(post("/api/v1/gas-relayer/compensate")
                        .header(ACCOUNT_HEADER, TestAccounts.RELAYER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"relayer": "%s", "gasUsed": 21000}
                                """.formatted(TestAccounts.RELAYER)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.compensation").value(693000000000000L))
                .andExpect(jsonPath("$.data.balance").value(693000000000000L));

        mockMvc.perform(get("/api/v1/gas-relayer/balance").param("relayer", TestAccounts.RELAYER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.balance").value(693000000000000L))
                .andExpect(jsonPath("$.data.dailyCompensated").value(693000000000000L));
    }

    @Test
    void compensate_fromNonRelayer_isForbidden() throws Exception {
        mockMvc.perform(post("/api/v1/gas-relayer/compensate")
                        .header(ACCOUNT_HEADER, TestAccounts.OUTSIDER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"relayer": "%s", "gasUsed": 21000}
                                """.formatted(TestAccounts.OUTSIDER)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));
    }

    @Test
    void feeMultiplier_outOfRange_isBadRequest() throws Exception {
        mockMvc.perform(put("/api/v1/gas-relayer/fee-multiplier")
                        .header(ACCOUNT_HEADER, TestAccounts.OPERATOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"multiplier\": 151}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_MULTIPLIER"))
                .andExpect(jsonPath("$.error.message").value("Multiplier must be <= 150"));

        mockMvc.perform(put("/api/v1/gas-relayer/fee-multiplier")
                        .header(ACCOUNT_HEADER, TestAccounts.OPERATOR)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"multiplier\": 125}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.feeMultiplier").value(125));
    }

    @Test
    void gasPriceUpdate_tooSoon_isConflict() throws Exception {
        mockMvc.perform(post("/api/v1/gas-relayer/gas-price/update").header(ACCOUNT_HEADER, TestAccounts.OPERATOR))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("TOO_SOON"))
                .andExpect(jsonPath("$.error.message").value("Too soon to update"));
    }

    @Test
    void pause_blocksCompensationUntilUnpaused() throws Exception {
        mockMvc.perform(post("/api/v1/gas-relayer/pause").header(ACCOUNT_HEADER, TestAccounts.RELAYER))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/v1/gas-relayer/pause").header(ACCOUNT_HEADER, TestAccounts.OPERATOR))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.paused").value(true));
        try {
            mockMvc.perform(post("/api/v1/gas-relayer/compensate")
                            .header(ACCOUNT_HEADER, TestAccounts.RELAYER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"relayer": "%s", "gasUsed": 21000}
                                    """.formatted(TestAccounts.RELAYER)))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error.code").value("SYSTEM_PAUSED"));
        } finally {
            feeOracle.unpause(TestAccounts.OPERATOR);
        }
    }
}
