package com.example.hrms.ratelimiter.util;

import com.example.hrms.ratelimiter.core.RateLimitDecision;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate Limiting 응답 처리 유틸리티
 */
@Slf4j
public final class ResponseUtil {

    // Rate Limiting 관련 HTTP 헤더
    public static final String HEADER_RATE_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RATE_LIMIT_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RETRY_AFTER = HttpHeaders.RETRY_AFTER;

    private ResponseUtil() {
    }

    /**
     * 모든 응답에 붙는 한도/잔여/리셋 헤더 설정
     */
    public static void setRateLimitHeaders(HttpServletResponse response, RateLimitDecision decision) {
        response.setHeader(HEADER_RATE_LIMIT, String.valueOf(decision.getLimit()));
        response.setHeader(HEADER_RATE_LIMIT_REMAINING, String.valueOf(decision.getRemaining()));
        response.setHeader(HEADER_RATE_LIMIT_RESET, String.valueOf(decision.getResetAt()));
    }

    /**
     * 429 응답 헤더 (잔여 0, Retry-After 포함)
     */
    public static HttpHeaders rejectionHeaders(RateLimitDecision decision) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HEADER_RATE_LIMIT, String.valueOf(decision.getLimit()));
        headers.set(HEADER_RATE_LIMIT_REMAINING, "0");
        headers.set(HEADER_RATE_LIMIT_RESET, String.valueOf(decision.getResetAt()));
        headers.set(HEADER_RETRY_AFTER, String.valueOf(decision.getRetryAfter()));
        return headers;
    }

    /**
     * 429 응답 본문
     */
    public static Map<String, Object> createErrorBody(RateLimitDecision decision) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", HttpStatus.TOO_MANY_REQUESTS.getReasonPhrase());
        body.put("message", "Rate limit exceeded. Try again in " + decision.getRetryAfter() + " seconds.");
        body.put("status", HttpStatus.TOO_MANY_REQUESTS.value());
        body.put("retryAfter", decision.getRetryAfter());
        body.put("timestamp", Instant.now().toString());
        return body;
    }

    /**
     * 필터 단계에서 직접 429 Too Many Requests 응답 작성
     */
    public static void sendTooManyRequestsResponse(HttpServletResponse response, RateLimitDecision decision,
                                                   ObjectMapper objectMapper) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        rejectionHeaders(decision).forEach((name, values) -> response.setHeader(name, values.get(0)));

        response.getWriter().write(objectMapper.writeValueAsString(createErrorBody(decision)));
        response.getWriter().flush();

        log.debug("429 response sent, retry after: {}s", decision.getRetryAfter());
    }
}
