package com.example.hrms.ratelimiter.core;

import lombok.Getter;

/**
 * 한도 초과로 요청이 거부되었음을 알리는 예외 (HTTP 429로 변환)
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final transient RateLimitDecision decision;

    public RateLimitExceededException(RateLimitDecision decision) {
        super("Rate limit exceeded. Try again in " + decision.getRetryAfter() + " seconds.");
        this.decision = decision;
    }

    public long getRetryAfterSeconds() {
        return decision.getRetryAfter();
    }
}
