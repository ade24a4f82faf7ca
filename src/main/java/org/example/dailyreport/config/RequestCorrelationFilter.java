package org.example.dailyreport.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.example.dailyreport.ratelimit.ClientIpResolver;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with an id and the resolved client address so limiter log lines can be traced.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = RequestCorrelation.normalizeRequestId(request.getHeader(RequestCorrelation.HEADER_NAME));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }

        request.setAttribute(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        response.setHeader(RequestCorrelation.HEADER_NAME, requestId);
        MDC.put(RequestCorrelation.ATTRIBUTE_NAME, requestId);
        MDC.put(RequestCorrelation.CLIENT_IP_MDC_KEY, ClientIpResolver.getClientIp(request));
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestCorrelation.ATTRIBUTE_NAME);
            MDC.remove(RequestCorrelation.CLIENT_IP_MDC_KEY);
        }
    }
}
