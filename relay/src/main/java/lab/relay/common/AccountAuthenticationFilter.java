package lab.relay.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lab.relay.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Binds the {@code X-Relay-Account} claim to a per-account API key. Role checks downstream trust the
 * account header, so a request naming an account must present that account's key.
 *
 * <p>With no keys configured the header is trusted as sent. Only mock mode starts that way.
 */
@Component
@Slf4j
public class AccountAuthenticationFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-Relay-Api-Key";

    private final Map<String, String> keysByAccount;
    private final ObjectMapper objectMapper;

    public AccountAuthenticationFilter(RelayProperties properties, ObjectMapper objectMapper) {
        this.keysByAccount = properties.getApi().getAccountKeys().stream()
                .collect(Collectors.toUnmodifiableMap(
                        entry -> entry.getAccount().trim().toLowerCase(Locale.ROOT),
                        RelayProperties.AccountKey::getKey
                ));
        this.objectMapper = objectMapper;
        if (keysByAccount.isEmpty()) {
            log.warn("event=account_auth.disabled reason=no_account_keys header={}", CorrelationIdFilter.ACCOUNT_HEADER);
        }
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String account = request.getHeader(CorrelationIdFilter.ACCOUNT_HEADER);
        if (keysByAccount.isEmpty() || account == null || account.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String expected = keysByAccount.get(account.trim().toLowerCase(Locale.ROOT));
        String presented = request.getHeader(API_KEY_HEADER);
        if (expected != null && presented != null
                && MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8))) {
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("event=account_auth.rejected account={} uri={} keyPresent={}", account, request.getRequestURI(), presented != null);
        response.setStatus(ErrorCode.UNAUTHENTICATED.getHttpStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), ApiResponse.failure(
                ErrorCode.UNAUTHENTICATED.name(),
                "Account " + account + " is not authenticated",
                Map.of("header", API_KEY_HEADER)
        ));
    }
}
