package org.example.dailyreport.controller;

import org.example.dailyreport.config.AdminApiKeyInterceptor;
import org.example.dailyreport.config.RateLimitInterceptor;
import org.example.dailyreport.config.RateLimitMvcConfig;
import org.example.dailyreport.ratelimit.RateLimitGuard;
import org.example.dailyreport.ratelimit.RateLimiterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RateLimitAdminController.class)
@Import({
        RateLimitMvcConfig.class,
        RateLimitInterceptor.class,
        AdminApiKeyInterceptor.class,
        RateLimitGuard.class,
        RateLimiterRegistry.class
})
@TestPropertySource(properties = "rate-limit.admin.api-key=")
class RateLimitAdminControllerUnconfiguredTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void adminEndpoint_withoutConfiguredKey_isUnavailable() throws Exception {
        mockMvc.perform(get("/api/admin/rate-limits").header("X-API-Key", "anything"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code", is("SERVICE_UNAVAILABLE")));
    }
}
