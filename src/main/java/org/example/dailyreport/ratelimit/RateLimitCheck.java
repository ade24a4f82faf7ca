package org.example.dailyreport.ratelimit;

import java.util.Map;

/**
 * Result of a guarded request together with the headers to attach to the response.
 */
public record RateLimitCheck(RateLimitResult result, Map<String, String> headers) {

    public boolean allowed() {
        return result.allowed();
    }
}
