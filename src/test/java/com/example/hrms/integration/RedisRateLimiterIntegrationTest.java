package com.example.hrms.integration;

import com.example.hrms.auth.RevocationStatus;
import com.example.hrms.auth.TokenRevocationStore;
import com.example.hrms.ratelimiter.core.RateLimitDecision;
import com.example.hrms.ratelimiter.redis.RedisRateLimiterEngine;
import com.example.hrms.ratelimiter.util.ClientIpResolver;
import com.example.hrms.store.RedisStore;
import com.example.hrms.store.TemplateRedisStore;
import com.example.hrms.util.HashUtil;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 실제 Redis 컨테이너를 사용하는 통합 테스트
 * 시간은 테스트에서 제어하는 Clock으로 움직이므로 대기 없이 윈도우 경과를 검증합니다.
 */
@Slf4j
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Redis Rate Limiter 통합 테스트")
class RedisRateLimiterIntegrationTest {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    private MutableClock clock;
    private RedisRateLimiterEngine engine;
    private TokenRevocationStore revocationStore;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
        }
    }

    @BeforeEach
    void setUp() {
        redisTemplate.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
        clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));
        RedisStore store = new TemplateRedisStore(redisTemplate, CircuitBreaker.ofDefaults("redis-store-test"));
        engine = new RedisRateLimiterEngine(store, new ClientIpResolver(), clock, 10);
        engine.connect();
        revocationStore = new TokenRevocationStore(store, clock);
        revocationStore.connect();
    }

    @Test
    @DisplayName("슬라이딩 윈도우 - limit까지 허용, 초과 시 거부, 남은 수는 1씩 감소")
    void slidingWindowLimit() {
        String key = "rl:_api_v1_auth_login:ip:203.0.113.7";

        for (int i = 0; i < 5; i++) {
            RateLimitDecision decision = engine.checkSlidingWindow(key, 5, 60);
            assertTrue(decision.isAllowed(), (i + 1) + "번째 요청은 허용되어야 합니다");
            assertFalse(decision.isDegraded());
            assertEquals(4 - i, decision.getRemaining());
        }

        RateLimitDecision rejected = engine.checkSlidingWindow(key, 5, 60);
        assertFalse(rejected.isAllowed(), "6번째 요청은 거부되어야 합니다");
        assertEquals(0, rejected.getRemaining());
        assertEquals(60, rejected.getRetryAfter());
        log.info("거부 판정: {}", rejected);
    }

    @Test
    @DisplayName("슬라이딩 윈도우 - 가장 오래된 요청이 윈도우를 벗어나면 다시 허용")
    void slidingWindowRecovers() {
        String key = "rl:_api_v1_auth_login:ip:203.0.113.8";
        for (int i = 0; i < 5; i++) {
            engine.checkSlidingWindow(key, 5, 60);
        }

        clock.advance(Duration.ofSeconds(30));
        RateLimitDecision stillRejected = engine.checkSlidingWindow(key, 5, 60);
        assertFalse(stillRejected.isAllowed());
        assertEquals(30, stillRejected.getRetryAfter(), "재시도 시간은 가장 오래된 요청 기준이어야 합니다");

        clock.advance(Duration.ofSeconds(31));
        assertTrue(engine.checkSlidingWindow(key, 5, 60).isAllowed(), "윈도우 경과 후에는 허용되어야 합니다");
    }

    @Test
    @DisplayName("슬라이딩 윈도우 - 키 만료 시간은 윈도우 + 여유 시간 이하")
    void slidingWindowKeyExpires() {
        String key = "rl:_ttl:ip:1.1.1.1";
        engine.checkSlidingWindow(key, 5, 60);

        Long ttl = redisTemplate.getExpire(key, TimeUnit.SECONDS);
        assertNotNull(ttl);
        assertTrue(ttl > 0 && ttl <= 70, "TTL은 70초 이하여야 합니다: " + ttl);
    }

    @Test
    @DisplayName("토큰 버킷 - 버스트 후 보충 속도만큼 다시 허용")
    void tokenBucketBurstAndRefill() {
        String key = "rl:_api_v1_employees:user:42";

        for (int i = 0; i < 10; i++) {
            assertTrue(engine.checkTokenBucket(key, 10, 1.0).isAllowed(), (i + 1) + "번째 요청은 허용되어야 합니다");
        }
        RateLimitDecision rejected = engine.checkTokenBucket(key, 10, 1.0);
        assertFalse(rejected.isAllowed());
        assertEquals(1, rejected.getRetryAfter());

        clock.advance(Duration.ofSeconds(2));
        assertTrue(engine.checkTokenBucket(key, 10, 1.0).isAllowed());
        assertTrue(engine.checkTokenBucket(key, 10, 1.0).isAllowed());
        assertFalse(engine.checkTokenBucket(key, 10, 1.0).isAllowed(), "보충된 토큰 2개만 사용할 수 있어야 합니다");
    }

    @Test
    @DisplayName("동시 요청 - 여러 스레드가 같은 키를 검사해도 limit만큼만 허용")
    void concurrentRequestsRespectLimit() throws Exception {
        String key = "rl:_api_v1_reports:ip:10.0.0.1";
        int threads = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RateLimitDecision>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return engine.checkSlidingWindow(key, 10, 60);
                }));
            }
            start.countDown();

            int allowed = 0;
            for (Future<RateLimitDecision> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).isAllowed()) {
                    allowed++;
                }
            }
            assertEquals(10, allowed, "정확히 limit만큼만 허용되어야 합니다");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("파티션 독립성 - 다른 IP의 쿼터에 영향을 주지 않음")
    void partitionsAreIndependent() {
        for (int i = 0; i < 5; i++) {
            engine.checkSlidingWindow("rl:_api_v1_auth_login:ip:1.1.1.1", 5, 60);
        }

        assertFalse(engine.checkSlidingWindow("rl:_api_v1_auth_login:ip:1.1.1.1", 5, 60).isAllowed());
        assertTrue(engine.checkSlidingWindow("rl:_api_v1_auth_login:ip:2.2.2.2", 5, 60).isAllowed());
    }

    @Test
    @DisplayName("스크립트 캐시가 비워져도 재적재 후 정상 판정")
    void recoversFromScriptFlush() {
        redisTemplate.execute((RedisCallback<Void>) connection -> {
            connection.scriptingCommands().scriptFlush();
            return null;
        });

        RateLimitDecision decision = engine.checkSlidingWindow("rl:_flush:ip:1.1.1.1", 5, 60);

        assertTrue(decision.isAllowed());
        assertFalse(decision.isDegraded(), "NOSCRIPT 이후 재적재되어 정상 판정이어야 합니다");
    }

    @Test
    @DisplayName("토큰 폐기 - 남은 유효 시간 동안 폐기 상태 유지")
    void tokenRevocation() {
        String token = "header.payload.signature";
        Instant expiry = clock.instant().plusSeconds(900);

        assertEquals(RevocationStatus.ACTIVE, revocationStore.check(token, "42", clock.instant().getEpochSecond()));
        assertTrue(revocationStore.revoke(token, expiry));
        assertTrue(revocationStore.isRevoked(token));

        Long ttl = redisTemplate.getExpire(keyOf(token), TimeUnit.SECONDS);
        assertNotNull(ttl);
        assertTrue(ttl > 890 && ttl <= 900, "TTL은 남은 유효 시간이어야 합니다: " + ttl);
    }

    @Test
    @DisplayName("사용자 전체 폐기 - 이전 발급 토큰만 무효")
    void identityRevocation() {
        long issuedBefore = clock.instant().getEpochSecond() - 60;
        assertTrue(revocationStore.revokeAllForIdentity("42"));

        clock.advance(Duration.ofSeconds(5));
        long issuedAfter = clock.instant().getEpochSecond();

        assertEquals(RevocationStatus.IDENTITY_REVOKED, revocationStore.check("old-token", "42", issuedBefore));
        assertEquals(RevocationStatus.ACTIVE, revocationStore.check("new-token", "42", issuedAfter));
    }

    private static String keyOf(String token) {
        return TokenRevocationStore.TOKEN_PREFIX + HashUtil.sha256Hex(token);
    }

    static final class MutableClock extends Clock {

        private volatile Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
