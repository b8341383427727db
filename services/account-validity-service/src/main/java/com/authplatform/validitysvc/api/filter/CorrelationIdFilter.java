package com.authplatform.validitysvc.api.filter;

import com.authplatform.validitysvc.shared.security.SecurityUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Tags every request with a correlation id for the MDC and echoes it in the response.
 * The id comes from {@value #CORRELATION_ID_HEADER}, then {@value #REQUEST_ID_HEADER}
 * as sent by the gateway, and is generated otherwise.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final SecurityUtils securityUtils;

    public CorrelationIdFilter(SecurityUtils securityUtils) {
        this.securityUtils = securityUtils;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String incoming = request.getHeader(CORRELATION_ID_HEADER);
        if (incoming == null || incoming.isBlank()) {
            incoming = request.getHeader(REQUEST_ID_HEADER);
        }
        String correlationId = securityUtils.getOrCreateCorrelationId(incoming);
        securityUtils.setMdcContext(correlationId, null);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            chain.doFilter(request, response);
        } finally {
            securityUtils.clearMdcContext();
        }
    }
}
