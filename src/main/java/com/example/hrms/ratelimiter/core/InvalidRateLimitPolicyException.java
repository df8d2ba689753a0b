package com.example.hrms.ratelimiter.core;

/**
 * 잘못된 Rate Limit 설정 (음수 한도, 0 윈도우 등)
 */
public class InvalidRateLimitPolicyException extends IllegalArgumentException {

    public InvalidRateLimitPolicyException(String message) {
        super(message);
    }
}
