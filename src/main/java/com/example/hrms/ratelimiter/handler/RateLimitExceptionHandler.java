package com.example.hrms.ratelimiter.handler;

import com.example.hrms.ratelimiter.core.RateLimitExceededException;
import com.example.hrms.ratelimiter.util.ResponseUtil;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * {@link RateLimitExceededException}을 429 Too Many Requests 응답으로 변환
 */
@Slf4j
@RestControllerAdvice
public class RateLimitExceptionHandler {

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimit(RateLimitExceededException ex,
                                                               HttpServletRequest request) {
        log.warn("Request rejected - path: {}, retry after: {}s", request.getRequestURI(), ex.getRetryAfterSeconds());
        return new ResponseEntity<>(
                ResponseUtil.createErrorBody(ex.getDecision()),
                ResponseUtil.rejectionHeaders(ex.getDecision()),
                HttpStatus.TOO_MANY_REQUESTS);
    }
}
