package com.example.hrms.store;

import java.time.Duration;
import java.util.List;

/**
 * Rate Limiter, 토큰 폐기 저장소, 캐시가 함께 사용하는 Redis 접근 포트
 *
 * 구현체는 하나의 공유 커넥션 풀 위에서 동작해야 하며, 모든 명령은 제한된 타임아웃을 가져야 합니다.
 * 실패는 예외로 전달되고, 호출하는 쪽에서 {@link StoreFailure#classify(Throwable)}로 분류합니다.
 */
public interface RedisStore {

    /**
     * 연결 상태 확인 (PING)
     */
    void ping();

    /**
     * Lua 스크립트를 서버 캐시에 적재하고 SHA1 핸들을 반환합니다.
     */
    String scriptLoad(String script);

    /**
     * 캐시된 스크립트를 단일 키로 실행합니다 (EVALSHA sha 1 key args...)
     *
     * @return 스크립트가 반환한 배열 (정수 원소)
     */
    List<Object> evalSha(String sha, String key, String... args);

    void setex(String key, String value, Duration ttl);

    boolean exists(String key);

    /**
     * @return 값, 키가 없으면 null
     */
    String get(String key);

    boolean delete(String key);
}
