package lab.relay.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import lab.relay.config.RelayProperties;
import lab.relay.testutil.TestAccounts;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class AccountAuthenticationFilterTest {

    private static final String ADMIN_KEY = "admin-secret";

    @Test
    void matchingKey_passesThrough() throws Exception {
        MockFilterChain chain = new MockFilterChain();
        MockHttpServletResponse response = new MockHttpServletResponse();

        filterWithKeys().doFilter(request(TestAccounts.OPERATOR.toLowerCase(), ADMIN_KEY), response, chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    void wrongOrMissingKey_isRejectedBeforeTheController() throws Exception {
        for (String key : new String[] {"guess", null}) {
            MockFilterChain chain = new MockFilterChain();
            MockHttpServletResponse response = new MockHttpServletResponse();

            filterWithKeys().doFilter(request(TestAccounts.OPERATOR, key), response, chain);

            assertThat(chain.getRequest()).isNull();
            assertThat(response.getStatus()).isEqualTo(401);
            assertThat(response.getContentAsString()).contains("\"code\":\"UNAUTHENTICATED\"");
        }
    }

    @Test
    void accountWithoutConfiguredKey_isRejected() throws Exception {
        MockFilterChain chain = new MockFilterChain();
        MockHttpServletResponse response = new MockHttpServletResponse();

        filterWithKeys().doFilter(request(TestAccounts.RELAYER, ADMIN_KEY), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(401);
    }

    @Test
    void noAccountHeader_passesThrough() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filterWithKeys().doFilter(new MockHttpServletRequest("GET", "/api/v1/health"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void noKeysConfigured_trustsHeader() throws Exception {
        MockFilterChain chain = new MockFilterChain();
        AccountAuthenticationFilter filter = new AccountAuthenticationFilter(new RelayProperties(), new ObjectMapper());

        filter.doFilter(request(TestAccounts.OPERATOR, null), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    private static AccountAuthenticationFilter filterWithKeys() {
        RelayProperties properties = new RelayProperties();
        RelayProperties.AccountKey adminKey = new RelayProperties.AccountKey();
        adminKey.setAccount(TestAccounts.OPERATOR);
        adminKey.setKey(ADMIN_KEY);
        properties.getApi().getAccountKeys().add(adminKey);
        return new AccountAuthenticationFilter(properties, new ObjectMapper());
    }

    private static MockHttpServletRequest request(String account, String key) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/gas-relayer/pause");
        request.addHeader(CorrelationIdFilter.ACCOUNT_HEADER, account);
        if (key != null) {
            request.addHeader(AccountAuthenticationFilter.API_KEY_HEADER, key);
        }
        return request;
    }
}
