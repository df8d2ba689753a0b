package com.example.hrms.ratelimiter.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Rate Limiting 판정 결과
 *
 * 요청마다 새로 생성되며 생성 후에는 변경할 수 없습니다.
 * 값을 바꾸려면 {@link #toBuilder()}로 새 인스턴스를 만듭니다.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@AllArgsConstructor
public class RateLimitDecision {

    private final boolean allowed;   // 요청 허용 여부
    private final long limit;        // 설정된 상한 (윈도우당 요청 수 또는 버킷 용량)
    private final long remaining;    // 이번 판정 이후 남은 요청/토큰 수, 거부 시 0
    private final long resetAt;      // 한도가 회복되는 시각 (epoch 초)
    private final long retryAfter;   // 재시도 권장 시간 (초), 허용 시 0
    private final boolean degraded;  // 저장소 장애로 검사 없이 허용된 경우 true

    //허용된 요청 결과 생성
    public static RateLimitDecision allowed(long limit, long remaining, long resetAt) {
        return RateLimitDecision.builder()
                .allowed(true)
                .limit(limit)
                .remaining(clamp(remaining, limit))
                .resetAt(resetAt)
                .retryAfter(0)
                .build();
    }

    //거부된 요청 결과 생성
    public static RateLimitDecision rejected(long limit, long resetAt, long retryAfter) {
        return RateLimitDecision.builder()
                .allowed(false)
                .limit(limit)
                .remaining(0)
                .resetAt(resetAt)
                .retryAfter(Math.max(1, retryAfter))
                .build();
    }

    /**
     * fail-open 결과 생성
     * 저장소를 사용할 수 없을 때 한도 전체가 남은 것으로 보고 요청을 허용합니다.
     */
    public static RateLimitDecision failOpen(long limit, long resetAt) {
        long safeLimit = Math.max(0, limit);
        return RateLimitDecision.builder()
                .allowed(true)
                .limit(safeLimit)
                .remaining(safeLimit)
                .resetAt(resetAt)
                .retryAfter(0)
                .degraded(true)
                .build();
    }

    private static long clamp(long remaining, long limit) {
        return Math.max(0, Math.min(remaining, limit));
    }
}
