package org.example.dailyreport.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the caller identity used as rate limit key from proxy headers.
 * <p>
 * Headers are trusted as sent. Unless the edge proxy overwrites {@code X-Forwarded-For},
 * a client can pick its own identity and bypass limiting.
 */
public final class ClientIpResolver {

    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    public static final String REAL_IP_HEADER = "X-Real-IP";
    public static final String UNKNOWN = "unknown";

    private ClientIpResolver() {
    }

    public static String getClientIp(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }

        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isEmpty()) {
            int commaIndex = forwarded.indexOf(',');
            String first = (commaIndex >= 0 ? forwarded.substring(0, commaIndex) : forwarded).trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        String realIp = request.getHeader(REAL_IP_HEADER);
        if (realIp != null && !realIp.isEmpty()) {
            return realIp;
        }

        return UNKNOWN;
    }
}
