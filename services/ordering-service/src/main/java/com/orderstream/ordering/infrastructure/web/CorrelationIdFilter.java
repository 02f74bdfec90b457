package com.orderstream.ordering.infrastructure.web;

import com.orderstream.observability.CorrelationContext;
import com.orderstream.observability.CorrelationContextHolder;
import com.orderstream.security.RoleHeaderParser;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs every HTTP request under a {@link CorrelationContext}.
 *
 * <p>An incoming {@code X-Correlation-ID} is propagated, otherwise a new UUID is generated; either
 * way it is echoed on the response. The caller id from {@code X-User-Id} and a fresh request id
 * are added so the MDC carries all three. Mutations published while the request runs are logged
 * under the same correlation id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        String userId = request.getHeader(RoleHeaderParser.USER_ID_HEADER);
        if (userId != null && userId.isBlank()) {
            userId = null;
        }

        CorrelationContextHolder.set(new CorrelationContext(correlationId, userId, UUID.randomUUID().toString()));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
