package com.example.hrms.ratelimiter.gate;

import com.example.hrms.ratelimiter.core.RateLimitAttributes;
import com.example.hrms.ratelimiter.core.RateLimitDecision;
import com.example.hrms.ratelimiter.core.RateLimitExceededException;
import com.example.hrms.ratelimiter.core.RateLimitStrategy;
import com.example.hrms.ratelimiter.core.RateLimiter;
import com.example.hrms.ratelimiter.util.RequestPaths;
import jakarta.servlet.http.HttpServletRequest;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 하나의 라우트 설정에 묶인 재사용 가능한 요청 허용 검사
 *
 * 상태를 갖지 않으며 모든 상태는 Redis에 있습니다.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class AdmissionGate {

    private final AdmissionPolicy policy;
    private final RateLimiter rateLimiter;

    /**
     * 요청을 검사하고 판정 결과를 요청 속성에 기록합니다.
     *
     * @return 허용된 경우의 판정 결과 (enforce=false면 거부 판정도 그대로 반환)
     * @throws RateLimitExceededException 한도를 초과한 경우
     */
    public RateLimitDecision check(HttpServletRequest request) {
        String key = partitionKey(request);

        RateLimitDecision decision = policy.getStrategy() == RateLimitStrategy.TOKEN_BUCKET
                ? rateLimiter.checkTokenBucket(key, policy.getLimit(), policy.refillRate())
                : rateLimiter.checkSlidingWindow(key, policy.getLimit(), policy.getWindowSeconds());

        // 허용/거부와 관계없이 헤더 필터가 읽을 수 있도록 기록
        request.setAttribute(RateLimitAttributes.DECISION, decision);

        if (!decision.isAllowed()) {
            if (!policy.isEnforce()) {
                log.debug("Rate limit exceeded (observe only) - key: {}", key);
                return decision;
            }
            log.debug("Request rejected - key: {}, retry after: {}s", key, decision.getRetryAfter());
            throw new RateLimitExceededException(decision);
        }
        return decision;
    }

    /**
     * 파티션 키 계산: 사용자별 제한이고 인증된 사용자가 있으면 user, 아니면 ip
     */
    public String partitionKey(HttpServletRequest request) {
        return PartitionKey.of(policy.getKeyPrefix(), RequestPaths.routePath(request), resolveIdentity(request));
    }

    private String resolveIdentity(HttpServletRequest request) {
        if (policy.isPerUser()) {
            Object userId = request.getAttribute(RateLimitAttributes.USER_ID);
            if (userId != null && !userId.toString().isBlank()) {
                return PartitionKey.userIdentity(userId.toString());
            }
        }
        return PartitionKey.ipIdentity(rateLimiter.getClientIdentity(request));
    }
}
