package com.example.hrms.ratelimiter.core;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 분산 Rate Limiter 엔진의 공통 인터페이스
 *
 * 구현체는 어떤 경우에도 예외를 던지지 않아야 합니다.
 * 저장소 장애 시에는 허용 판정(fail-open)을 반환합니다.
 */
public interface RateLimiter {

    /**
     * 슬라이딩 윈도우 알고리즘으로 요청 허용 여부를 검사하고 카운트를 증가시킵니다.
     *
     * @param key 파티션 키
     * @param limit 윈도우 내 최대 요청 수
     * @param windowSeconds 윈도우 크기 (초)
     */
    RateLimitDecision checkSlidingWindow(String key, int limit, int windowSeconds);

    /**
     * 토큰 버킷 알고리즘으로 토큰 1개를 소비합니다.
     *
     * @param key 파티션 키
     * @param capacity 버킷 용량 (최대 버스트)
     * @param refillRate 초당 보충 토큰 수
     */
    RateLimitDecision checkTokenBucket(String key, int capacity, double refillRate);

    /**
     * 요청 메타데이터에서 클라이언트 식별자(IP)를 추출합니다. 식별할 수 없으면 "unknown"
     */
    String getClientIdentity(HttpServletRequest request);
}
