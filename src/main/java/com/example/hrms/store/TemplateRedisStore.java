package com.example.hrms.store;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.ReturnType;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * StringRedisTemplate 기반 {@link RedisStore} 구현
 *
 * 커넥션 풀은 Spring Boot가 생성하는 Lettuce 커넥션 팩토리 하나를 공유합니다.
 * 모든 호출은 서킷 브레이커를 거치므로 Redis 장애 중에는 소켓 타임아웃을 기다리지 않고 즉시 실패합니다.
 */
@Slf4j
@RequiredArgsConstructor
public class TemplateRedisStore implements RedisStore {

    private final StringRedisTemplate redisTemplate;
    private final CircuitBreaker circuitBreaker;

    @Override
    public void ping() {
        String pong = call(() -> redisTemplate.execute((RedisCallback<String>) RedisConnection::ping));
        log.debug("Redis PING -> {}", pong);
    }

    @Override
    public String scriptLoad(String script) {
        byte[] body = script.getBytes(StandardCharsets.UTF_8);
        return call(() -> redisTemplate.execute(
                (RedisCallback<String>) connection -> connection.scriptingCommands().scriptLoad(body)));
    }

    @Override
    public List<Object> evalSha(String sha, String key, String... args) {
        byte[][] keysAndArgs = new byte[args.length + 1][];
        keysAndArgs[0] = key.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < args.length; i++) {
            keysAndArgs[i + 1] = args[i].getBytes(StandardCharsets.UTF_8);
        }
        return call(() -> redisTemplate.execute((RedisCallback<List<Object>>) connection ->
                connection.scriptingCommands().evalSha(sha, ReturnType.MULTI, 1, keysAndArgs)));
    }

    @Override
    public void setex(String key, String value, Duration ttl) {
        call(() -> {
            redisTemplate.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(call(() -> redisTemplate.hasKey(key)));
    }

    @Override
    public String get(String key) {
        return call(() -> redisTemplate.opsForValue().get(key));
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(call(() -> redisTemplate.delete(key)));
    }

    private <T> T call(Supplier<T> command) {
        return circuitBreaker.executeSupplier(command);
    }
}
