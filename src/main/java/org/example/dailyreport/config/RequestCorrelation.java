package org.example.dailyreport.config;

import jakarta.servlet.http.HttpServletRequest;

public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String CLIENT_IP_MDC_KEY = "clientIp";
    public static final String UNKNOWN = "unknown";

    private static final int MAX_REQUEST_ID_LENGTH = 80;

    private RequestCorrelation() {
    }

    public static String resolveRequestId(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        Object requestId = request.getAttribute(ATTRIBUTE_NAME);
        if (requestId instanceof String value && !value.isBlank()) {
            return value;
        }
        return UNKNOWN;
    }

    /**
     * Trims a caller supplied request id, or returns null when it is unusable.
     */
    static String normalizeRequestId(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_REQUEST_ID_LENGTH ? trimmed.substring(0, MAX_REQUEST_ID_LENGTH) : trimmed;
    }
}
