package com.example.hrms.ratelimiter.core;

/**
 * Rate Limiting 관련 요청 속성 키
 */
public final class RateLimitAttributes {

    /**
     * 인증 계층이 설정하는 사용자 식별자
     */
    public static final String USER_ID = "hrms.userId";

    /**
     * Admission Gate가 판정 결과를 기록하는 속성. 응답 헤더 필터가 읽습니다.
     */
    public static final String DECISION = "hrms.rateLimitDecision";

    private RateLimitAttributes() {
    }
}
