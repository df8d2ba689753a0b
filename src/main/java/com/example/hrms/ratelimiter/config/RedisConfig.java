package com.example.hrms.ratelimiter.config;

import com.example.hrms.auth.TokenRevocationStore;
import com.example.hrms.cache.RedisCache;
import com.example.hrms.ratelimiter.redis.RedisRateLimiterEngine;
import com.example.hrms.ratelimiter.util.ClientIpResolver;
import com.example.hrms.store.RedisStore;
import com.example.hrms.store.StoreFailure;
import com.example.hrms.store.TemplateRedisStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Redis 설정 클래스
 *
 * Spring Boot가 만드는 Lettuce 커넥션 팩토리 하나를 Rate Limiter, 토큰 폐기 저장소, 캐시가 공유합니다.
 * 커넥션/명령 타임아웃은 spring.data.redis.connect-timeout, spring.data.redis.timeout 으로 설정합니다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RateLimiterProperties.class)
public class RedisConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 연결 불가/타임아웃만 실패로 기록하는 서킷 브레이커
     * NOSCRIPT 같은 명령 오류로는 열리지 않습니다.
     */
    @Bean
    public CircuitBreaker redisStoreCircuitBreaker(RateLimiterProperties properties) {
        RateLimiterProperties.CircuitBreakerConfig config = properties.getCircuitBreaker();
        CircuitBreaker circuitBreaker = CircuitBreaker.of("redis-store", CircuitBreakerConfig.custom()
                .failureRateThreshold(config.getFailureRateThreshold())
                .minimumNumberOfCalls(config.getMinimumNumberOfCalls())
                .slidingWindowSize(config.getSlidingWindowSize())
                .waitDurationInOpenState(config.getWaitDurationInOpenState())
                .recordException(error -> StoreFailure.classify(error).isConnectivity())
                .build());
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Redis circuit breaker state changed: {}", event.getStateTransition()));
        return circuitBreaker;
    }

    @Bean
    public RedisStore redisStore(StringRedisTemplate stringRedisTemplate, CircuitBreaker redisStoreCircuitBreaker) {
        return new TemplateRedisStore(stringRedisTemplate, redisStoreCircuitBreaker);
    }

    @Bean(destroyMethod = "close")
    public RedisRateLimiterEngine redisRateLimiterEngine(RedisStore redisStore, RateLimiterProperties properties,
                                                         Clock clock) {
        return new RedisRateLimiterEngine(redisStore, new ClientIpResolver(properties.getTrustedProxyHeader()),
                clock, properties.getExpirySlackSeconds());
    }

    @Bean(destroyMethod = "close")
    public TokenRevocationStore tokenRevocationStore(RedisStore redisStore, Clock clock) {
        return new TokenRevocationStore(redisStore, clock);
    }

    @Bean
    public RedisCache redisCache(RedisStore redisStore, ObjectMapper objectMapper) {
        return new RedisCache(redisStore, objectMapper, RedisCache.DEFAULT_PREFIX);
    }
}
