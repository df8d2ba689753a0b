package com.example.hrms.ratelimiter.script;

/**
 * Redis 서버에서 원자적으로 실행되는 Rate Limiting Lua 스크립트
 *
 * 검사와 갱신을 한 번의 왕복으로 처리하므로 같은 키에 대한 동시 요청이
 * 갱신 전 카운트를 함께 읽고 각각 허용하는 경쟁 상태가 생기지 않습니다.
 * Redis는 Lua 숫자를 정수로 잘라서 반환하므로 반환값은 스크립트 안에서 정수로 맞춥니다.
 */
public enum RateLimitScript {

    /**
     * 슬라이딩 윈도우
     *
     * <p>KEYS[1] 파티션 키, ARGV: limit, window(초), now(초, 소수), request_id, slack(초)
     * <p>반환: {allowed, remaining, reset_at}
     */
    SLIDING_WINDOW("""
            local key = KEYS[1]
            local limit = tonumber(ARGV[1])
            local window = tonumber(ARGV[2])
            local now = tonumber(ARGV[3])
            local request_id = ARGV[4]
            local slack = tonumber(ARGV[5])

            -- 윈도우를 벗어난 요청 제거
            redis.call('ZREMRANGEBYSCORE', key, 0, now - window)

            local count = redis.call('ZCARD', key)

            if count < limit then
                -- 같은 시각의 요청이 겹치지 않도록 고유 ID로 기록
                redis.call('ZADD', key, now, request_id)
                redis.call('EXPIRE', key, math.ceil(window + slack))
                return {1, limit - count - 1, math.floor(now + window)}
            end

            -- 가장 오래된 요청이 윈도우를 벗어나는 시각
            local reset_at = now + window
            local oldest = redis.call('ZRANGE', key, 0, 0, 'WITHSCORES')
            if oldest and #oldest >= 2 then
                reset_at = tonumber(oldest[2]) + window
            end
            return {0, 0, math.ceil(reset_at)}
            """),

    /**
     * 토큰 버킷
     *
     * <p>KEYS[1] 파티션 키, ARGV: capacity, refill_rate(초당), now(초, 소수), requested, slack(초)
     * <p>반환: 허용 시 {1, floor(tokens), 가득 찰 때까지 초}, 거부 시 {0, 0, 대기 초}
     */
    TOKEN_BUCKET("""
            local key = KEYS[1]
            local capacity = tonumber(ARGV[1])
            local refill_rate = tonumber(ARGV[2])
            local now = tonumber(ARGV[3])
            local requested = tonumber(ARGV[4])
            local slack = tonumber(ARGV[5])

            local bucket = redis.call('HMGET', key, 'tokens', 'last_refill')
            local tokens = tonumber(bucket[1]) or capacity
            local last_refill = tonumber(bucket[2]) or now

            -- 경과 시간만큼 연속 보충 (소수 토큰 유지)
            local elapsed = math.max(0, now - last_refill)
            tokens = math.min(capacity, tokens + elapsed * refill_rate)

            local ttl = math.ceil(capacity / refill_rate) + slack

            if tokens >= requested then
                tokens = tokens - requested
                redis.call('HSET', key, 'tokens', tostring(tokens), 'last_refill', tostring(now))
                redis.call('EXPIRE', key, ttl)
                return {1, math.floor(tokens), math.ceil((capacity - tokens) / refill_rate)}
            end

            -- 부족해도 보충된 상태는 저장
            redis.call('HSET', key, 'tokens', tostring(tokens), 'last_refill', tostring(now))
            redis.call('EXPIRE', key, ttl)
            return {0, 0, math.ceil((requested - tokens) / refill_rate)}
            """);

    private final String source;

    RateLimitScript(String source) {
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
