package com.example.hrms.ratelimiter.annotation;

import com.example.hrms.ratelimiter.core.RateLimitStrategy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Redis 기반 Rate Limit 어노테이션
 *
 * 컨트롤러 메서드에 적용하면 여러 인스턴스가 공유하는 분산 Rate Limiting이 적용됩니다.
 * <pre>
 * &#64;PostMapping("/api/v1/auth/login")
 * &#64;RateLimit(limit = 5, windowSeconds = 60)
 * public TokenResponse login(...) { ... }
 * </pre>
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimit {

    /**
     * 최대 허용 요청 수 (토큰 버킷에서는 버킷 용량)
     */
    int limit();

    /**
     * 시간 윈도우 (초)
     * 토큰 버킷에서는 limit / windowSeconds 가 초당 보충 속도가 됩니다.
     */
    int windowSeconds() default 60;

    /**
     * true면 인증된 사용자별로, 아니면 클라이언트 IP별로 제한
     */
    boolean perUser() default false;

    RateLimitStrategy strategy() default RateLimitStrategy.SLIDING_WINDOW;

    /**
     * Redis 키 접두사
     */
    String keyPrefix() default "rl";

    /**
     * false면 판정 결과를 헤더로만 노출하고 요청은 거부하지 않음
     */
    boolean enforce() default true;
}
