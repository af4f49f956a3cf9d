package com.streamearn.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamearn.service.RateController;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the rate-limit interceptor on every API route, so no endpoint can
 * be reached without passing the rate controller first.
 */
@Configuration
public class RateLimitWebConfig implements WebMvcConfigurer {

    private final RateController rateController;
    private final ObjectMapper objectMapper;

    public RateLimitWebConfig(RateController rateController, ObjectMapper objectMapper) {
        this.rateController = rateController;
        this.objectMapper = objectMapper;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new RateLimitInterceptor(rateController, objectMapper))
                .addPathPatterns("/api/**");
    }
}
