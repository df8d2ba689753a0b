package com.example.hrms.ratelimiter.config;

import com.example.hrms.ratelimiter.core.RateLimitStrategy;
import com.example.hrms.ratelimiter.gate.AdmissionPolicy;
import com.example.hrms.ratelimiter.util.ClientIpResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rate Limiter 설정 프로퍼티
 */
@Data
@Validated
@ConfigurationProperties(prefix = "rate-limiter")
public class RateLimiterProperties {

    private boolean enabled = true; // Rate Limiter 활성화

    @NotBlank
    private String keyPrefix = AdmissionPolicy.DEFAULT_KEY_PREFIX; // URL 패턴 설정의 기본 키 접두사

    @Min(0)
    private int expirySlackSeconds = 10; // 윈도우/버킷 키 만료 여유 시간

    private String trustedProxyHeader = ClientIpResolver.DEFAULT_TRUSTED_PROXY_HEADER; // 신뢰하는 엣지 프록시 헤더

    private List<String> excludedPaths = new ArrayList<>(List.of("/actuator/**", "/health"));

    @Valid
    private Map<String, UrlPatternConfig> urlPatterns = new LinkedHashMap<>(); // URL 패턴별 Rate Limit 설정

    @Valid
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

    @Data
    public static class UrlPatternConfig {
        @NotNull
        @Min(1)
        private Integer limit;
        private Integer windowSeconds = AdmissionPolicy.DEFAULT_WINDOW_SECONDS;
        private boolean perUser;
        private RateLimitStrategy strategy = RateLimitStrategy.SLIDING_WINDOW;
        private String keyPrefix; // 비어 있으면 rate-limiter.key-prefix 사용
        private boolean enforce = true;

        public AdmissionPolicy toPolicy(String defaultKeyPrefix) {
            return AdmissionPolicy.builder()
                    .limit(limit)
                    .windowSeconds(windowSeconds)
                    .perUser(perUser)
                    .strategy(strategy)
                    .keyPrefix(keyPrefix != null ? keyPrefix : defaultKeyPrefix)
                    .enforce(enforce)
                    .build();
        }
    }

    /**
     * Redis 호출 서킷 브레이커 설정
     */
    @Data
    public static class CircuitBreakerConfig {
        private float failureRateThreshold = 50;
        private int minimumNumberOfCalls = 10;
        private int slidingWindowSize = 20;
        private Duration waitDurationInOpenState = Duration.ofSeconds(10);
    }
}
