package com.example.hrms.ratelimiter.gate;

import com.example.hrms.ratelimiter.core.InvalidRateLimitPolicyException;
import com.example.hrms.ratelimiter.core.RateLimitStrategy;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 라우트 하나에 적용되는 선언적 Rate Limit 설정
 *
 * 잘못된 값은 생성 시점에 {@link InvalidRateLimitPolicyException}으로 거부합니다.
 * 엔진까지 잘못된 값이 전달되면 검사 없이 허용되므로 설정 단계에서 막습니다.
 */
@Getter
@ToString
@EqualsAndHashCode
public class AdmissionPolicy {

    public static final String DEFAULT_KEY_PREFIX = "rl";
    public static final int DEFAULT_WINDOW_SECONDS = 60;

    private final int limit;                  // 윈도우당 요청 수 또는 버킷 용량
    private final int windowSeconds;          // 윈도우 크기, 토큰 버킷에서는 보충 속도 계산에 사용
    private final boolean perUser;            // 인증된 사용자별 제한 여부
    private final RateLimitStrategy strategy;
    private final String keyPrefix;
    private final boolean enforce;            // false면 판정만 기록하고 거부하지 않음

    @Builder
    private AdmissionPolicy(int limit, Integer windowSeconds, boolean perUser,
                            RateLimitStrategy strategy, String keyPrefix, Boolean enforce) {
        this.limit = limit;
        this.windowSeconds = windowSeconds != null ? windowSeconds : DEFAULT_WINDOW_SECONDS;
        this.perUser = perUser;
        this.strategy = strategy != null ? strategy : RateLimitStrategy.SLIDING_WINDOW;
        this.keyPrefix = keyPrefix != null ? keyPrefix : DEFAULT_KEY_PREFIX;
        this.enforce = enforce == null || enforce;
        validate();
    }

    public static AdmissionPolicy of(int limit, int windowSeconds) {
        return AdmissionPolicy.builder().limit(limit).windowSeconds(windowSeconds).build();
    }

    /**
     * 토큰 버킷 보충 속도 (초당). 윈도우가 0이면 초당 1개
     */
    public double refillRate() {
        return windowSeconds > 0 ? (double) limit / windowSeconds : 1.0;
    }

    private void validate() {
        if (limit <= 0) {
            throw new InvalidRateLimitPolicyException("limit must be positive: " + limit);
        }
        if (windowSeconds < 0 || (windowSeconds == 0 && strategy == RateLimitStrategy.SLIDING_WINDOW)) {
            throw new InvalidRateLimitPolicyException(
                    "windowSeconds must be positive for " + strategy + ": " + windowSeconds);
        }
        if (keyPrefix.isBlank() || keyPrefix.contains(" ")) {
            throw new InvalidRateLimitPolicyException("keyPrefix must be a non-blank token: '" + keyPrefix + "'");
        }
    }
}
