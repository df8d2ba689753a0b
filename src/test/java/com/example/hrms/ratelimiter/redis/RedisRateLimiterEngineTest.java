package com.example.hrms.ratelimiter.redis;

import com.example.hrms.ratelimiter.core.RateLimitDecision;
import com.example.hrms.ratelimiter.script.RateLimitScript;
import com.example.hrms.ratelimiter.util.ClientIpResolver;
import com.example.hrms.store.RedisStore;
import io.lettuce.core.RedisNoScriptException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.RedisSystemException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Redis 엔진 단위 테스트
 * 저장소를 목으로 대체하여 결과 해석, 스크립트 재적재, 장애 시 fail-open 동작을 검증합니다.
 */
@Slf4j
@DisplayName("Redis Rate Limiter 엔진 테스트")
class RedisRateLimiterEngineTest {

    private static final String WINDOW_SHA = "sha-window";
    private static final String BUCKET_SHA = "sha-bucket";
    private static final long NOW = 1_000L;

    private RedisStore store;
    private RedisRateLimiterEngine engine;

    @BeforeEach
    void setUp() {
        store = mock(RedisStore.class);
        when(store.scriptLoad(anyString())).thenAnswer(invocation ->
                RateLimitScript.SLIDING_WINDOW.getSource().equals(invocation.getArgument(0)) ? WINDOW_SHA : BUCKET_SHA);
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        engine = new RedisRateLimiterEngine(store, new ClientIpResolver(), clock, 10);
    }

    @Test
    @DisplayName("연결 - 두 스크립트를 적재하고 재호출해도 다시 적재하지 않음")
    void connectIsIdempotent() {
        engine.connect();
        engine.connect();

        assertTrue(engine.isConnected());
        verify(store, times(1)).ping();
        verify(store, times(2)).scriptLoad(anyString());
    }

    @Test
    @DisplayName("Redis 연결 불가 - 예외 없이 허용(fail-open)해야 함")
    void failsOpenWhenUnreachable() {
        doThrow(new RedisConnectionFailureException("Unable to connect to localhost:6379")).when(store).ping();

        engine.connect();
        RateLimitDecision decision = engine.checkSlidingWindow("rl:_login:ip:1.2.3.4", 5, 60);

        assertFalse(engine.isConnected());
        assertTrue(decision.isAllowed(), "Redis 장애 중에는 요청이 허용되어야 합니다");
        assertTrue(decision.isDegraded());
        assertEquals(5, decision.getRemaining());
        assertEquals(NOW + 60, decision.getResetAt());
        verify(store, never()).evalSha(anyString(), anyString(), any(String[].class));
        log.info("fail-open 판정: {}", decision);
    }

    @Test
    @DisplayName("장애 중 동시 요청 - 한 스레드만 재연결하고 나머지는 기다리지 않고 허용")
    void concurrentChecksDoNotQueueOnReconnect() throws Exception {
        long storeTimeoutMillis = 300;
        doAnswer(invocation -> {
            Thread.sleep(storeTimeoutMillis);
            throw new RedisConnectionFailureException("Unable to connect to localhost:6379");
        }).when(store).ping();

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Long>> latencies = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                latencies.add(executor.submit(() -> {
                    start.await();
                    long begin = System.nanoTime();
                    RateLimitDecision decision = engine.checkSlidingWindow("k", 5, 60);
                    assertTrue(decision.isDegraded());
                    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);
                }));
            }
            start.countDown();

            long maxLatency = 0;
            for (Future<Long> latency : latencies) {
                maxLatency = Math.max(maxLatency, latency.get(10, TimeUnit.SECONDS));
            }
            log.info("저장소 타임아웃 {}ms, 최대 검사 지연 {}ms", storeTimeoutMillis, maxLatency);
            assertTrue(maxLatency < storeTimeoutMillis * 3,
                    "요청 지연은 재연결 대기 때문에 누적되면 안 됩니다: " + maxLatency + "ms");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("슬라이딩 윈도우 허용 결과 해석")
    void parsesSlidingWindowAllowed() {
        when(store.evalSha(eq(WINDOW_SHA), eq("k"), any(String[].class))).thenReturn(List.of(1L, 4L, 1_060L));

        RateLimitDecision decision = engine.checkSlidingWindow("k", 5, 60);

        assertTrue(decision.isAllowed());
        assertFalse(decision.isDegraded());
        assertEquals(5, decision.getLimit());
        assertEquals(4, decision.getRemaining());
        assertEquals(1_060L, decision.getResetAt());
    }

    @Test
    @DisplayName("슬라이딩 윈도우 거부 - 재시도 시간은 resetAt - now")
    void parsesSlidingWindowRejected() {
        when(store.evalSha(eq(WINDOW_SHA), eq("k"), any(String[].class))).thenReturn(List.of(0L, 0L, 1_030L));

        RateLimitDecision decision = engine.checkSlidingWindow("k", 5, 60);

        assertFalse(decision.isAllowed());
        assertEquals(0, decision.getRemaining());
        assertEquals(1_030L, decision.getResetAt());
        assertEquals(30, decision.getRetryAfter());
    }

    @Test
    @DisplayName("토큰 버킷 거부 - 대기 시간이 retryAfter, now + 대기 시간이 resetAt")
    void parsesTokenBucketRejected() {
        when(store.evalSha(eq(BUCKET_SHA), eq("k"), any(String[].class))).thenReturn(List.of(0L, 0L, 2L));

        RateLimitDecision decision = engine.checkTokenBucket("k", 10, 0.5);

        assertFalse(decision.isAllowed());
        assertEquals(2, decision.getRetryAfter());
        assertEquals(NOW + 2, decision.getResetAt());
        assertEquals(10, decision.getLimit());
    }

    @Test
    @DisplayName("토큰 버킷 허용 - 바이트 배열 응답도 해석해야 함")
    void parsesTokenBucketAllowedFromBytes() {
        when(store.evalSha(eq(BUCKET_SHA), eq("k"), any(String[].class))).thenReturn(List.of(
                "1".getBytes(StandardCharsets.UTF_8),
                "9".getBytes(StandardCharsets.UTF_8),
                "1".getBytes(StandardCharsets.UTF_8)));

        RateLimitDecision decision = engine.checkTokenBucket("k", 10, 1.0);

        assertTrue(decision.isAllowed());
        assertEquals(9, decision.getRemaining());
        assertEquals(NOW + 1, decision.getResetAt());
    }

    @Test
    @DisplayName("NOSCRIPT - 스크립트를 다시 적재하고 한 번 재시도해야 함")
    void reloadsScriptOnNoScript() {
        RedisSystemException noScript = new RedisSystemException("Error in execution",
                new RedisNoScriptException("NOSCRIPT No matching script. Please use EVAL."));
        when(store.evalSha(eq(WINDOW_SHA), eq("k"), any(String[].class)))
                .thenThrow(noScript)
                .thenReturn(List.of(1L, 4L, 1_060L));

        RateLimitDecision decision = engine.checkSlidingWindow("k", 5, 60);

        assertTrue(decision.isAllowed());
        assertFalse(decision.isDegraded(), "재적재 후에는 정상 판정이어야 합니다");
        verify(store, times(3)).scriptLoad(anyString());
        verify(store, times(2)).evalSha(eq(WINDOW_SHA), eq("k"), any(String[].class));
    }

    @Test
    @DisplayName("타임아웃 - fail-open 후 연결을 해제하고 다음 요청에서 재연결")
    void timeoutDisconnectsAndReconnects() {
        when(store.evalSha(eq(WINDOW_SHA), eq("k"), any(String[].class)))
                .thenThrow(new QueryTimeoutException("Redis command timed out"))
                .thenReturn(List.of(1L, 3L, 1_060L));

        RateLimitDecision first = engine.checkSlidingWindow("k", 5, 60);
        assertTrue(first.isDegraded());
        assertFalse(engine.isConnected(), "타임아웃 후에는 연결 해제 상태여야 합니다");

        RateLimitDecision second = engine.checkSlidingWindow("k", 5, 60);
        assertFalse(second.isDegraded());
        assertTrue(engine.isConnected());
        verify(store, times(2)).ping();
    }

    @Test
    @DisplayName("예상하지 못한 오류 - fail-open 하되 연결은 유지")
    void unexpectedErrorKeepsConnection() {
        when(store.evalSha(anyString(), anyString(), any(String[].class)))
                .thenThrow(new IllegalStateException("WRONGTYPE Operation against a key"));

        RateLimitDecision decision = engine.checkTokenBucket("k", 10, 1.0);

        assertTrue(decision.isAllowed());
        assertTrue(decision.isDegraded());
        assertTrue(engine.isConnected());
    }

    @Test
    @DisplayName("비정상 응답 - 원소가 부족하면 fail-open")
    void shortResultFailsOpen() {
        when(store.evalSha(anyString(), anyString(), any(String[].class))).thenReturn(List.of(1L));

        assertTrue(engine.checkSlidingWindow("k", 5, 60).isDegraded());
    }

    @Test
    @DisplayName("잘못된 파라미터 - 저장소를 호출하지 않고 fail-open")
    void invalidParametersFailOpen() {
        assertTrue(engine.checkSlidingWindow("k", 0, 60).isDegraded());
        assertTrue(engine.checkSlidingWindow("k", 5, 0).isDegraded());
        assertTrue(engine.checkTokenBucket("k", 10, 0).isDegraded());
        assertTrue(engine.checkTokenBucket("k", 10, Double.NaN).isDegraded());
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("종료 - 스크립트 핸들을 버리고 연결 해제 상태가 되어야 함")
    void closeReleasesHandles() {
        engine.connect();
        engine.close();

        assertFalse(engine.isConnected());
    }
}
