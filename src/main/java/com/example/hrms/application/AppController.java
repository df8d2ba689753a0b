package com.example.hrms.application;

import com.example.hrms.auth.RevocationStatus;
import com.example.hrms.auth.TokenRevocationStore;
import com.example.hrms.ratelimiter.annotation.RateLimit;
import com.example.hrms.ratelimiter.core.RateLimitAttributes;
import com.example.hrms.ratelimiter.core.RateLimitStrategy;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Rate Limit과 토큰 폐기 동작을 확인하기 위한 엔드포인트
 * 실제 인사 도메인 API는 별도 서비스에 있으며 여기서는 제한 설정만 재현합니다.
 */
@RestController
@RequiredArgsConstructor
public class AppController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenRevocationStore tokenRevocationStore;

    @GetMapping("/health")
    public String healthCheck() {
        return "Application is running";
    }

    @PostMapping("/api/v1/auth/login")
    @RateLimit(limit = 5, windowSeconds = 60)
    public Map<String, Object> login() {
        return Map.of("status", "ok");
    }

    @PostMapping("/api/v1/auth/logout")
    @RateLimit(limit = 10, windowSeconds = 60, perUser = true)
    public ResponseEntity<Map<String, Object>> logout(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
                                                      @RequestParam long expiresAt) {
        boolean revoked = tokenRevocationStore.revoke(bearerToken(authorization), Instant.ofEpochSecond(expiresAt));
        if (!revoked) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("revoked", false, "message", "Logout could not be recorded. Please retry."));
        }
        return ResponseEntity.ok(Map.of("revoked", true));
    }

    @PostMapping("/api/v1/auth/sessions/revoke-all")
    @RateLimit(limit = 3, windowSeconds = 300, perUser = true)
    public ResponseEntity<Map<String, Object>> revokeAllSessions(
            @RequestAttribute(RateLimitAttributes.USER_ID) String userId) {
        boolean revoked = tokenRevocationStore.revokeAllForIdentity(userId);
        HttpStatus status = revoked ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(Map.of("revoked", revoked));
    }

    @GetMapping("/api/v1/auth/token/status")
    public Map<String, Object> tokenStatus(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
                                           @RequestParam(required = false) String sub,
                                           @RequestParam(required = false) Long iat) {
        RevocationStatus status = tokenRevocationStore.check(bearerToken(authorization), sub, iat);
        return Map.of("status", status.name());
    }

    @GetMapping("/api/v1/employees")
    @RateLimit(limit = 100, windowSeconds = 60, perUser = true, strategy = RateLimitStrategy.TOKEN_BUCKET)
    public Map<String, Object> employees() {
        return Map.of("items", List.of());
    }

    @GetMapping("/api/v1/leave/balance")
    @RateLimit(limit = 30, windowSeconds = 60, enforce = false)
    public Map<String, Object> leaveBalance() {
        return Map.of("annual", 15, "sick", 10);
    }

    private static String bearerToken(String authorization) {
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return authorization;
    }
}
