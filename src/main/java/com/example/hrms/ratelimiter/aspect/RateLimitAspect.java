package com.example.hrms.ratelimiter.aspect;

import com.example.hrms.ratelimiter.annotation.RateLimit;
import com.example.hrms.ratelimiter.config.RateLimiterProperties;
import com.example.hrms.ratelimiter.gate.AdmissionGateFactory;
import com.example.hrms.ratelimiter.gate.AdmissionPolicy;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Rate Limit AOP Aspect
 * {@link RateLimit} 어노테이션이 적용된 메서드의 호출을 가로채서 Admission Gate를 실행합니다.
 * 거부되면 RateLimitExceededException이 던져지고 RateLimitExceptionHandler가 429로 변환합니다.
 */
@Slf4j
@Aspect
@RequiredArgsConstructor
public class RateLimitAspect {

    private final AdmissionGateFactory gateFactory;
    private final RateLimiterProperties properties;

    @Around("@annotation(rateLimit)")
    public Object around(ProceedingJoinPoint joinPoint, RateLimit rateLimit) throws Throwable {
        if (!properties.isEnabled()) {
            return joinPoint.proceed();
        }

        HttpServletRequest request = currentRequest();
        if (request == null) {
            // 웹 요청 밖에서 호출된 경우 (스케줄러 등)
            log.debug("No current request for {}, skipping rate limit", joinPoint.getSignature());
            return joinPoint.proceed();
        }

        gateFactory.create(toPolicy(rateLimit)).check(request);
        return joinPoint.proceed();
    }

    static AdmissionPolicy toPolicy(RateLimit rateLimit) {
        return AdmissionPolicy.builder()
                .limit(rateLimit.limit())
                .windowSeconds(rateLimit.windowSeconds())
                .perUser(rateLimit.perUser())
                .strategy(rateLimit.strategy())
                .keyPrefix(rateLimit.keyPrefix())
                .enforce(rateLimit.enforce())
                .build();
    }

    private HttpServletRequest currentRequest() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes) {
            return attributes.getRequest();
        }
        return null;
    }
}
