package com.example.hrms.ratelimiter.core;

/**
 * Rate Limiting 알고리즘
 */
public enum RateLimitStrategy {
    SLIDING_WINDOW,  // 슬라이딩 윈도우 (요청 로그 기반)
    TOKEN_BUCKET     // 토큰 버킷 (버스트 허용)
}
