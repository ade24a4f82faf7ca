package org.example.dailyreport.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.example.dailyreport.ratelimit.RateLimitCheck;
import org.example.dailyreport.ratelimit.RateLimitGuard;
import org.example.dailyreport.ratelimit.RateLimitHeaders;
import org.example.dailyreport.ratelimit.RateLimitPreset;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.util.UrlPathHelper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    static final String ERROR_CODE = "RATE_LIMIT_EXCEEDED";

    private final RateLimitGuard rateLimitGuard;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final UrlPathHelper pathHelper = new UrlPathHelper();

    public RateLimitInterceptor(RateLimitGuard rateLimitGuard, ObjectMapper objectMapper, RateLimitProperties properties) {
        this.rateLimitGuard = rateLimitGuard;
        this.objectMapper = objectMapper;
        this.enabled = properties.isEnabled();
        // classify the path the handler mapping sees: decoded, without ;params or context path
        this.pathHelper.setUrlDecode(true);
        this.pathHelper.setRemoveSemicolonContent(true);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (!enabled) {
            return true;
        }

        String path = pathHelper.getPathWithinApplication(request);
        Optional<RateLimitPreset> preset = RateLimitedEndpointMatcher.classify(request.getMethod(), path);
        if (preset.isEmpty()) {
            return true;
        }

        RateLimitCheck check = rateLimitGuard.checkRateLimit(request, preset.get(), preset.get().limiterName());
        RateLimitHeaders.applyTo(check.headers(), response);
        if (check.allowed()) {
            return true;
        }

        writeTooManyRequests(request, response, check);
        return false;
    }

    private void writeTooManyRequests(HttpServletRequest request, HttpServletResponse response, RateLimitCheck check)
            throws Exception {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", ERROR_CODE);
        error.put("message", "Too many requests. Please try again later.");
        error.put("retryAfterSeconds", Long.parseLong(check.headers().get(RateLimitHeaders.RETRY_AFTER)));
        error.put("requestId", RequestCorrelation.resolveRequestId(request));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
