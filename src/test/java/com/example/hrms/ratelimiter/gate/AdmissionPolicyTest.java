package com.example.hrms.ratelimiter.gate;

import com.example.hrms.ratelimiter.core.InvalidRateLimitPolicyException;
import com.example.hrms.ratelimiter.core.RateLimitStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AdmissionPolicy 설정 검증 테스트")
class AdmissionPolicyTest {

    @Test
    @DisplayName("기본값 - 60초 슬라이딩 윈도우, 접두사 rl, 강제 적용")
    void defaults() {
        AdmissionPolicy policy = AdmissionPolicy.builder().limit(5).build();

        assertEquals(60, policy.getWindowSeconds());
        assertEquals(RateLimitStrategy.SLIDING_WINDOW, policy.getStrategy());
        assertEquals("rl", policy.getKeyPrefix());
        assertTrue(policy.isEnforce());
        assertFalse(policy.isPerUser());
    }

    @Test
    @DisplayName("보충 속도는 limit / window, window가 0이면 초당 1개")
    void refillRate() {
        assertEquals(100.0 / 60, AdmissionPolicy.of(100, 60).refillRate(), 1e-9);

        AdmissionPolicy zeroWindow = AdmissionPolicy.builder()
                .limit(10).windowSeconds(0).strategy(RateLimitStrategy.TOKEN_BUCKET).build();
        assertEquals(1.0, zeroWindow.refillRate(), 1e-9);
    }

    @Test
    @DisplayName("잘못된 설정은 생성 시점에 거부되어야 함")
    void invalidPoliciesAreRejected() {
        assertThrows(InvalidRateLimitPolicyException.class, () -> AdmissionPolicy.of(0, 60));
        assertThrows(InvalidRateLimitPolicyException.class, () -> AdmissionPolicy.of(-1, 60));
        assertThrows(InvalidRateLimitPolicyException.class, () -> AdmissionPolicy.of(5, 0));
        assertThrows(InvalidRateLimitPolicyException.class, () -> AdmissionPolicy.builder()
                .limit(5).windowSeconds(-1).strategy(RateLimitStrategy.TOKEN_BUCKET).build());
        assertThrows(InvalidRateLimitPolicyException.class, () -> AdmissionPolicy.builder()
                .limit(5).keyPrefix(" ").build());
        assertThrows(InvalidRateLimitPolicyException.class, () -> AdmissionPolicy.builder()
                .limit(5).keyPrefix("my prefix").build());
    }

    @Test
    @DisplayName("같은 설정은 동등해야 함")
    void equalPolicies() {
        assertEquals(AdmissionPolicy.of(5, 60), AdmissionPolicy.builder().limit(5).windowSeconds(60).build());
        assertNotEquals(AdmissionPolicy.of(5, 60), AdmissionPolicy.of(5, 30));
    }
}
