package com.flagship.wallet_ledger.observability;

import com.flagship.wallet_ledger.identity.HeaderCurrentUserProvider;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Puts the request's correlation id and acting user into the MDC so every log
 * line of a wallet operation can be traced back to one call.
 *
 * The correlation id is taken from {@code X-Correlation-ID} or minted, and
 * echoed on the response. The user id is copied as sent; whether it is valid
 * is decided later by the identity provider, which answers 401 if not.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        CorrelationContext.setCorrelationId(request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        String correlationId = CorrelationContext.getCorrelationId();
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

        String actingUser = request.getHeader(HeaderCurrentUserProvider.USER_ID_HEADER);
        if (actingUser != null && !actingUser.isBlank()) {
            MDC.put(CorrelationContext.USER_ID_MDC_KEY, actingUser.trim());
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/actuator") || path.equals("/health");
    }
}
