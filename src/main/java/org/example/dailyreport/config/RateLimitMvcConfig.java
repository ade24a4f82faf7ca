package org.example.dailyreport.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitMvcConfig implements WebMvcConfigurer {

    private final RateLimitInterceptor rateLimitInterceptor;
    private final AdminApiKeyInterceptor adminApiKeyInterceptor;

    public RateLimitMvcConfig(RateLimitInterceptor rateLimitInterceptor, AdminApiKeyInterceptor adminApiKeyInterceptor) {
        this.rateLimitInterceptor = rateLimitInterceptor;
        this.adminApiKeyInterceptor = adminApiKeyInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(rateLimitInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns("/api/admin/**");
        registry.addInterceptor(adminApiKeyInterceptor)
                .addPathPatterns("/api/admin/**");
    }
}
