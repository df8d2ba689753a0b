package com.example.hrms.cache;

import com.example.hrms.store.RedisStore;
import com.example.hrms.store.StoreFailure;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Redis 기반 캐시 (fail-open)
 *
 * - 값은 JSON으로 직렬화하여 TTL과 함께 저장
 * - 키 형식: {prefix}:{tenantId}:{key} 또는 {prefix}:{key}
 * - Redis 오류는 캐시 미스로 처리하며 예외를 전파하지 않음
 */
@Slf4j
@RequiredArgsConstructor
public class RedisCache {

    public static final String DEFAULT_PREFIX = "hrms:cache";
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final RedisStore store;
    private final ObjectMapper objectMapper;
    private final String prefix;

    public <T> Optional<T> get(String key, String tenantId, Class<T> type) {
        String fullKey = buildKey(key, tenantId);
        try {
            String json = store.get(fullKey);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Cache value for key {} could not be deserialized as {}: {}",
                    fullKey, type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logFailure("get", fullKey, e);
            return Optional.empty();
        }
    }

    public boolean set(String key, Object value, Duration ttl, String tenantId) {
        String fullKey = buildKey(key, tenantId);
        try {
            store.setex(fullKey, objectMapper.writeValueAsString(value), ttl);
            return true;
        } catch (JsonProcessingException e) {
            log.warn("Cache value for key {} could not be serialized: {}", fullKey, e.getOriginalMessage());
            return false;
        } catch (RuntimeException e) {
            logFailure("set", fullKey, e);
            return false;
        }
    }

    public boolean delete(String key, String tenantId) {
        String fullKey = buildKey(key, tenantId);
        try {
            return store.delete(fullKey);
        } catch (RuntimeException e) {
            logFailure("delete", fullKey, e);
            return false;
        }
    }

    public boolean exists(String key, String tenantId) {
        String fullKey = buildKey(key, tenantId);
        try {
            return store.exists(fullKey);
        } catch (RuntimeException e) {
            logFailure("exists", fullKey, e);
            return false;
        }
    }

    /**
     * 캐시에 있으면 반환하고, 없으면 loader로 계산하여 저장합니다. null 결과는 저장하지 않습니다.
     */
    public <T> T getOrLoad(String key, String tenantId, Class<T> type, Duration ttl, Supplier<T> loader) {
        Optional<T> cached = get(key, tenantId, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = loader.get();
        if (value != null) {
            set(key, value, ttl, tenantId);
        }
        return value;
    }

    String buildKey(String key, String tenantId) {
        if (tenantId != null && !tenantId.isBlank()) {
            return prefix + ":" + tenantId + ":" + key;
        }
        return prefix + ":" + key;
    }

    private void logFailure(String operation, String fullKey, RuntimeException e) {
        log.warn("Cache {} failed for key {} ({}): {}", operation, fullKey, StoreFailure.classify(e), e.getMessage());
    }
}
