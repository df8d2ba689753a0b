package com.example.hrms.ratelimiter.gate;

import com.example.hrms.ratelimiter.core.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;

/**
 * 선언적 설정으로부터 {@link AdmissionGate}를 생성하고 캐시하는 팩토리
 */
@Slf4j
@RequiredArgsConstructor
public class AdmissionGateFactory {

    private final RateLimiter rateLimiter;
    private final ConcurrentHashMap<AdmissionPolicy, AdmissionGate> gateCache = new ConcurrentHashMap<>();

    public AdmissionGate create(AdmissionPolicy policy) {
        return gateCache.computeIfAbsent(policy, p -> {
            log.info("Creating admission gate - strategy: {}, limit: {}, window: {}s, perUser: {}, prefix: {}",
                    p.getStrategy(), p.getLimit(), p.getWindowSeconds(), p.isPerUser(), p.getKeyPrefix());
            return new AdmissionGate(p, rateLimiter);
        });
    }
}
