package com.adsagent.patterns.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${aws.bedrock.rateLimit:2.0}") // permits per second shared by privacy scans and extractions
    private double rateLimit;

    @Bean("bedrockRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter bedrockRateLimiter() {
        return RateLimiter.create(Math.max(0.1, rateLimit));
    }
}
