package com.example.hrms.ratelimiter.config;

import com.example.hrms.ratelimiter.filter.RateLimitFilter;
import com.example.hrms.ratelimiter.filter.RateLimitHeaderFilter;
import com.example.hrms.ratelimiter.gate.AdmissionGateFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Rate Limit 필터 등록 및 설정
 *
 * 헤더 필터가 가장 바깥에서 응답을 감싸고, 그 안에서 URL 패턴 필터가 요청을 검사합니다.
 */
@Slf4j
@Configuration
public class FilterConfiguration {

    @Bean
    public FilterRegistrationBean<RateLimitHeaderFilter> rateLimitHeaderFilterRegistration() {
        FilterRegistrationBean<RateLimitHeaderFilter> registration =
                new FilterRegistrationBean<>(new RateLimitHeaderFilter());
        registration.addUrlPatterns("/*");
        registration.setName("rateLimitHeaderFilter");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(AdmissionGateFactory gateFactory,
                                                                               RateLimiterProperties properties,
                                                                               ObjectMapper objectMapper) {
        FilterRegistrationBean<RateLimitFilter> registration =
                new FilterRegistrationBean<>(new RateLimitFilter(gateFactory, properties, objectMapper));
        registration.addUrlPatterns("/*");
        registration.setName("rateLimitFilter");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);

        log.info("RateLimitFilter registered with {} URL pattern(s): {}",
                properties.getUrlPatterns().size(), properties.getUrlPatterns().keySet());
        return registration;
    }
}
