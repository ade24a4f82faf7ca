package org.example.dailyreport.config;

import org.example.dailyreport.ratelimit.RateLimitPreset;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps API routes to the rate limit preset that guards them.
 */
public final class RateLimitedEndpointMatcher {

    private static final Pattern LOGIN_PATH =
            Pattern.compile("^/api/auth/(login|callback/credentials)$");
    private static final Pattern PASSWORD_RESET_PATH =
            Pattern.compile("^/api/auth/password-reset(/.*)?$");
    private static final Pattern SEARCH_PATH =
            Pattern.compile("^/api/v1/((customers|sales-persons|reports)/)?search$");
    private static final Pattern UPLOAD_PATH =
            Pattern.compile("^/api/v1/(uploads|.+/attachments)$");
    private static final String VERSIONED_API_PREFIX = "/api/v1/";

    private RateLimitedEndpointMatcher() {
    }

    public static Optional<RateLimitPreset> classify(String method, String path) {
        if (method == null || path == null) {
            return Optional.empty();
        }

        if ("POST".equals(method)) {
            if (LOGIN_PATH.matcher(path).matches()) {
                return Optional.of(RateLimitPreset.LOGIN);
            }
            if (PASSWORD_RESET_PATH.matcher(path).matches()) {
                return Optional.of(RateLimitPreset.PASSWORD_RESET);
            }
            if (UPLOAD_PATH.matcher(path).matches()) {
                return Optional.of(RateLimitPreset.UPLOAD);
            }
        }

        if ("GET".equals(method) && SEARCH_PATH.matcher(path).matches()) {
            return Optional.of(RateLimitPreset.SEARCH);
        }

        if (path.startsWith(VERSIONED_API_PREFIX) && !"OPTIONS".equals(method)) {
            return Optional.of(RateLimitPreset.API);
        }

        return Optional.empty();
    }
}
