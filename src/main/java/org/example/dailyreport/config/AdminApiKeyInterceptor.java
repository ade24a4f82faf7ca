package org.example.dailyreport.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires the configured {@code X-API-Key} on administrative endpoints.
 */
@Component
public class AdminApiKeyInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AdminApiKeyInterceptor.class);

    static final String API_KEY_HEADER = "X-API-Key";

    private final String adminApiKey;

    public AdminApiKeyInterceptor(RateLimitProperties properties) {
        this.adminApiKey = properties.getAdmin().getApiKey();
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if ("OPTIONS".equals(request.getMethod())) {
            return true;
        }

        if (adminApiKey == null || adminApiKey.isBlank()) {
            log.warn("No admin API key is configured; blocking admin endpoint {}", request.getRequestURI());
            writeJson(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE,
                    "{\"success\":false,\"error\":{\"code\":\"SERVICE_UNAVAILABLE\",\"message\":\"Admin access is not configured\"}}");
            return false;
        }

        if (!constantTimeEquals(adminApiKey, request.getHeader(API_KEY_HEADER))) {
            writeJson(response, HttpServletResponse.SC_UNAUTHORIZED,
                    "{\"success\":false,\"error\":{\"code\":\"AUTH_UNAUTHORIZED\",\"message\":\"Admin API key required\"}}");
            return false;
        }

        return true;
    }

    private boolean constantTimeEquals(String expected, String provided) {
        if (expected == null || provided == null) {
            return false;
        }
        byte[] expectedBytes = expected.getBytes(StandardCharsets.UTF_8);
        byte[] providedBytes = provided.getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expectedBytes, providedBytes);
    }

    private void writeJson(HttpServletResponse response, int statusCode, String payload) throws Exception {
        response.setStatus(statusCode);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(payload);
    }
}
