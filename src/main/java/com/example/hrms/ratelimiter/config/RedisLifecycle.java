package com.example.hrms.ratelimiter.config;

import com.example.hrms.auth.TokenRevocationStore;
import com.example.hrms.ratelimiter.redis.RedisRateLimiterEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 Redis 연결과 스크립트 적재를 수행
 *
 * 연결에 실패해도 시작은 계속되며, 첫 요청에서 다시 연결을 시도합니다.
 * 종료 시 정리는 각 빈의 close()가 담당합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisLifecycle {

    private final RedisRateLimiterEngine rateLimiterEngine;
    private final TokenRevocationStore tokenRevocationStore;

    @EventListener(ApplicationReadyEvent.class)
    public void connect() {
        rateLimiterEngine.connect();
        tokenRevocationStore.connect();
        log.info("Redis services started - rate limiter connected: {}, revocation store connected: {}",
                rateLimiterEngine.isConnected(), tokenRevocationStore.isConnected());
    }
}
