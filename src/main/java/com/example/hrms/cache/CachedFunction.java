package com.example.hrms.cache;

import com.example.hrms.util.HashUtil;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.function.Function;

/**
 * 함수 결과를 Redis에 캐시하는 래퍼
 *
 * 캐시 키는 호출자가 넘긴 keyExtractor로만 만듭니다. 인자 목록을 리플렉션으로 읽지 않습니다.
 * <pre>
 * CachedFunction&lt;String, EmployeeSummary&gt; summaries = CachedFunction.&lt;String, EmployeeSummary&gt;builder(cache, "employees", EmployeeSummary.class)
 *         .key(id -&gt; id)
 *         .ttl(Duration.ofMinutes(1))
 *         .loader(employeeService::summarize)
 *         .build();
 * </pre>
 *
 * @param <A> 인자 타입
 * @param <V> 결과 타입
 */
@RequiredArgsConstructor
public class CachedFunction<A, V> implements Function<A, V> {

    static final int MAX_KEY_LENGTH = 200;
    private static final int HASHED_KEY_LENGTH = 16;

    private final RedisCache cache;
    private final String name;
    private final Class<V> type;
    private final Function<A, String> keyExtractor;
    private final Function<A, String> tenantExtractor;
    private final Function<A, V> loader;
    private final Duration ttl;

    @Override
    public V apply(A argument) {
        return cache.getOrLoad(cacheKey(argument), tenantExtractor.apply(argument), type, ttl,
                () -> loader.apply(argument));
    }

    /**
     * 캐시된 값을 무효화합니다.
     */
    public boolean invalidate(A argument) {
        return cache.delete(cacheKey(argument), tenantExtractor.apply(argument));
    }

    String cacheKey(A argument) {
        String key = name + ":" + keyExtractor.apply(argument);
        if (key.length() > MAX_KEY_LENGTH) {
            return name + ":" + HashUtil.sha256Hex(key).substring(0, HASHED_KEY_LENGTH);
        }
        return key;
    }

    public static <A, V> Builder<A, V> builder(RedisCache cache, String name, Class<V> type) {
        return new Builder<>(cache, name, type);
    }

    public static final class Builder<A, V> {

        private final RedisCache cache;
        private final String name;
        private final Class<V> type;
        private Function<A, String> keyExtractor;
        private Function<A, String> tenantExtractor = argument -> null;
        private Function<A, V> loader;
        private Duration ttl = RedisCache.DEFAULT_TTL;

        private Builder(RedisCache cache, String name, Class<V> type) {
            this.cache = cache;
            this.name = name;
            this.type = type;
        }

        public Builder<A, V> key(Function<A, String> keyExtractor) {
            this.keyExtractor = keyExtractor;
            return this;
        }

        public Builder<A, V> tenant(Function<A, String> tenantExtractor) {
            this.tenantExtractor = tenantExtractor;
            return this;
        }

        public Builder<A, V> loader(Function<A, V> loader) {
            this.loader = loader;
            return this;
        }

        public Builder<A, V> ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public CachedFunction<A, V> build() {
            if (keyExtractor == null || loader == null) {
                throw new IllegalStateException("key extractor and loader are required for cached function " + name);
            }
            return new CachedFunction<>(cache, name, type, keyExtractor, tenantExtractor, loader, ttl);
        }
    }
}
