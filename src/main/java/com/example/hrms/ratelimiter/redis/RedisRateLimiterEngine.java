package com.example.hrms.ratelimiter.redis;

import com.example.hrms.ratelimiter.core.RateLimitDecision;
import com.example.hrms.ratelimiter.core.RateLimiter;
import com.example.hrms.ratelimiter.script.RateLimitScript;
import com.example.hrms.ratelimiter.util.ClientIpResolver;
import com.example.hrms.store.RedisStore;
import com.example.hrms.store.StoreFailure;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Redis 기반 분산 Rate Limiter 엔진
 *
 * 동작 원리:
 * - 슬라이딩 윈도우와 토큰 버킷 Lua 스크립트를 SCRIPT LOAD로 미리 적재하고 SHA 핸들을 캐시
 * - 요청마다 EVALSHA 한 번으로 검사와 갱신을 원자적으로 처리
 * - 서버가 스크립트 캐시를 비운 경우(NOSCRIPT) 다시 적재하고 한 번만 재시도
 *
 * 장애 정책 (fail-open):
 * - Rate Limiter는 남용 방지용이며 정확성 보장 수단이 아니므로
 *   Redis 장애가 보호 대상 서비스의 장애로 번지지 않도록 모든 실패 경로에서 요청을 허용
 * - 연결 불가/타임아웃이면 연결 상태를 해제하여 다음 요청에서 다시 연결을 시도
 *
 * 프로세스 내 공유 상태는 스크립트 핸들과 연결 여부뿐이며, 동시성 제어는 모두 Redis에서 이루어집니다.
 */
@Slf4j
public class RedisRateLimiterEngine implements RateLimiter {

    private static final int REQUESTED_TOKENS = 1;

    private final RedisStore store;
    private final ClientIpResolver clientIpResolver;
    private final Clock clock;
    private final int expirySlackSeconds;

    private final Map<RateLimitScript, String> scriptShas = new ConcurrentHashMap<>();
    private final ReentrantLock connectLock = new ReentrantLock();
    private volatile boolean connected;

    public RedisRateLimiterEngine(RedisStore store, ClientIpResolver clientIpResolver,
                                  Clock clock, int expirySlackSeconds) {
        this.store = store;
        this.clientIpResolver = clientIpResolver;
        this.clock = clock;
        this.expirySlackSeconds = Math.max(0, expirySlackSeconds);
    }

    /**
     * Redis 연결 확인 후 두 스크립트를 미리 적재합니다.
     * 이미 연결된 경우 아무 일도 하지 않으며, 실패해도 예외를 던지지 않고 연결 해제 상태로 남습니다.
     *
     * <p>재연결은 한 스레드만 수행합니다. 다른 스레드가 연결 중이면 기다리지 않고 바로 반환하므로
     * 장애 중 요청 지연은 저장소 타임아웃 한 번으로 제한됩니다.
     */
    public void connect() {
        if (isConnected() || !connectLock.tryLock()) {
            return;
        }

        try {
            if (isConnected()) {
                return;
            }
            store.ping();
            for (RateLimitScript script : RateLimitScript.values()) {
                scriptShas.put(script, store.scriptLoad(script.getSource()));
            }
            connected = true;
            log.info("Rate limiter connected to Redis with {} Lua scripts loaded", scriptShas.size());
        } catch (RuntimeException e) {
            log.error("Failed to initialize rate limiter ({}): {}", StoreFailure.classify(e), e.getMessage());
            disconnect();
        } finally {
            connectLock.unlock();
        }
    }

    /**
     * 캐시된 스크립트 핸들을 버립니다. 커넥션 풀은 Spring 컨테이너가 관리합니다.
     */
    public void close() {
        connectLock.lock();
        try {
            if (connected) {
                log.info("Rate limiter disconnected from Redis");
            }
            disconnect();
        } finally {
            connectLock.unlock();
        }
    }

    public boolean isConnected() {
        return connected && scriptShas.size() == RateLimitScript.values().length;
    }

    @Override
    public RateLimitDecision checkSlidingWindow(String key, int limit, int windowSeconds) {
        double now = nowSeconds();
        Supplier<RateLimitDecision> failOpen =
                () -> RateLimitDecision.failOpen(limit, (long) now + Math.max(0, windowSeconds));

        if (limit <= 0 || windowSeconds <= 0) {
            log.error("Invalid sliding window parameters for key {}: limit={}, window={} - failing open",
                    key, limit, windowSeconds);
            return failOpen.get();
        }

        String requestId = toPlain(now) + ":" + UUID.randomUUID();
        List<String> args = List.of(
                String.valueOf(limit),
                String.valueOf(windowSeconds),
                toPlain(now),
                requestId,
                String.valueOf(expirySlackSeconds));

        return execute(RateLimitScript.SLIDING_WINDOW, key, args, failOpen, result -> {
            boolean allowed = toLong(result.get(0)) == 1;
            long remaining = toLong(result.get(1));
            long resetAt = toLong(result.get(2));
            if (allowed) {
                return RateLimitDecision.allowed(limit, remaining, resetAt);
            }
            return RateLimitDecision.rejected(limit, resetAt, resetAt - (long) now);
        });
    }

    @Override
    public RateLimitDecision checkTokenBucket(String key, int capacity, double refillRate) {
        double now = nowSeconds();
        boolean valid = capacity > 0 && refillRate > 0 && !Double.isNaN(refillRate) && !Double.isInfinite(refillRate);
        Supplier<RateLimitDecision> failOpen = () -> RateLimitDecision.failOpen(capacity,
                (long) now + (valid ? (long) Math.ceil(capacity / refillRate) : 0));

        if (!valid) {
            log.error("Invalid token bucket parameters for key {}: capacity={}, refillRate={} - failing open",
                    key, capacity, refillRate);
            return failOpen.get();
        }

        List<String> args = List.of(
                String.valueOf(capacity),
                toPlain(refillRate),
                toPlain(now),
                String.valueOf(REQUESTED_TOKENS),
                String.valueOf(expirySlackSeconds));

        return execute(RateLimitScript.TOKEN_BUCKET, key, args, failOpen, result -> {
            boolean allowed = toLong(result.get(0)) == 1;
            long remaining = toLong(result.get(1));
            long waitSeconds = toLong(result.get(2));
            long resetAt = (long) (now + waitSeconds);
            if (allowed) {
                return RateLimitDecision.allowed(capacity, remaining, resetAt);
            }
            return RateLimitDecision.rejected(capacity, resetAt, waitSeconds);
        });
    }

    @Override
    public String getClientIdentity(HttpServletRequest request) {
        return clientIpResolver.resolve(request);
    }

    private RateLimitDecision execute(RateLimitScript script, String key, List<String> args,
                                      Supplier<RateLimitDecision> failOpen,
                                      Function<List<Object>, RateLimitDecision> parser) {
        if (!isConnected()) {
            connect();
        }
        if (!isConnected()) {
            log.warn("Redis unavailable - rate limit bypassed for key {}", key);
            return failOpen.get();
        }

        try {
            List<Object> result = evalWithReload(script, key, args);
            if (result == null || result.size() < 3) {
                log.error("Unexpected {} script result for key {}: {} - failing open", script, key, result);
                return failOpen.get();
            }
            return parser.apply(result);
        } catch (RuntimeException e) {
            StoreFailure failure = StoreFailure.classify(e);
            switch (failure) {
                case UNREACHABLE, TIMEOUT -> {
                    log.error("Redis {} during {} check for key {}: {} - failing open",
                            failure, script, key, e.getMessage());
                    disconnect();
                }
                default -> log.error("Rate limiter error ({}) for key {} - failing open", failure, key, e);
            }
            return failOpen.get();
        }
    }

    private List<Object> evalWithReload(RateLimitScript script, String key, List<String> args) {
        String[] argv = args.toArray(new String[0]);
        String cachedSha = scriptShas.get(script);
        if (cachedSha == null) {
            throw new IllegalStateException("Script handle for " + script + " was released concurrently");
        }
        try {
            return store.evalSha(cachedSha, key, argv);
        } catch (RuntimeException e) {
            if (StoreFailure.classify(e) != StoreFailure.SCRIPT_MISSING) {
                throw e;
            }
            log.warn("Lua script {} not found in Redis, reloading", script);
            String sha = store.scriptLoad(script.getSource());
            scriptShas.put(script, sha);
            return store.evalSha(sha, key, argv);
        }
    }

    private void disconnect() {
        connected = false;
        scriptShas.clear();
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    private static String toPlain(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof byte[] bytes) {
            return Long.parseLong(new String(bytes, StandardCharsets.UTF_8));
        }
        return Long.parseLong(String.valueOf(value));
    }
}
