package lab.relay.common;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

@Component
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String ACCOUNT_HEADER = "X-Relay-Account";
    public static final String MDC_CORRELATION_ID_KEY = "correlationId";
    public static final String MDC_ACCOUNT_KEY = "account";

    // Client-supplied ids end up in every log line of the request.
    private static final Pattern SAFE_CORRELATION_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(MDC_CORRELATION_ID_KEY, correlationId);
        String account = request.getHeader(ACCOUNT_HEADER);
        if (account != null && !account.isBlank()) {
            MDC.put(MDC_ACCOUNT_KEY, account.trim().toLowerCase(Locale.ROOT));
        }
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_CORRELATION_ID_KEY);
            MDC.remove(MDC_ACCOUNT_KEY);
        }
    }

    static String resolveCorrelationId(String incoming) {
        if (incoming != null) {
            String trimmed = incoming.trim();
            if (SAFE_CORRELATION_ID.matcher(trimmed).matches()) {
                return trimmed;
            }
        }
        return "relay-" + UUID.randomUUID();
    }
}
