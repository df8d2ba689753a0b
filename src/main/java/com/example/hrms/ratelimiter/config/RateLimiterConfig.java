package com.example.hrms.ratelimiter.config;

import com.example.hrms.ratelimiter.aspect.RateLimitAspect;
import com.example.hrms.ratelimiter.core.RateLimiter;
import com.example.hrms.ratelimiter.gate.AdmissionGateFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Admission Gate 관련 빈 등록
 */
@Configuration
public class RateLimiterConfig {

    @Bean
    public AdmissionGateFactory admissionGateFactory(RateLimiter rateLimiter) {
        return new AdmissionGateFactory(rateLimiter);
    }

    @Bean
    public RateLimitAspect rateLimitAspect(AdmissionGateFactory admissionGateFactory,
                                           RateLimiterProperties properties) {
        return new RateLimitAspect(admissionGateFactory, properties);
    }
}
