package com.example.hrms.ratelimiter.filter;

import com.example.hrms.ratelimiter.config.RateLimiterProperties;
import com.example.hrms.ratelimiter.core.RateLimitExceededException;
import com.example.hrms.ratelimiter.gate.AdmissionGate;
import com.example.hrms.ratelimiter.gate.AdmissionGateFactory;
import com.example.hrms.ratelimiter.util.RequestPaths;
import com.example.hrms.ratelimiter.util.ResponseUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 설정 파일의 URL 패턴별 Rate Limit을 적용하는 서블릿 필터
 *
 * rate-limiter.url-patterns 에 선언된 순서대로 처음 일치하는 패턴 하나만 적용합니다.
 * 게이트는 생성 시점에 설정을 검증하므로 잘못된 설정은 애플리케이션 시작 시 실패합니다.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    private final RateLimiterProperties properties;
    private final ObjectMapper objectMapper;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final Map<String, AdmissionGate> gates = new LinkedHashMap<>();

    public RateLimitFilter(AdmissionGateFactory gateFactory, RateLimiterProperties properties,
                           ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        properties.getUrlPatterns().forEach((pattern, config) ->
                gates.put(pattern, gateFactory.create(config.toPolicy(properties.getKeyPrefix()))));
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        AdmissionGate gate = selectGate(RequestPaths.routePath(request));
        if (gate == null) {
            filterChain.doFilter(request, response);
            return;
        }

        try {
            gate.check(request);
        } catch (RateLimitExceededException e) {
            log.warn("Request rejected - path: {}, retry after: {}s", request.getRequestURI(), e.getRetryAfterSeconds());
            ResponseUtil.sendTooManyRequestsResponse(response, e.getDecision(), objectMapper);
            return;
        }
        filterChain.doFilter(request, response);
    }

    private AdmissionGate selectGate(String requestPath) {
        for (Map.Entry<String, AdmissionGate> entry : gates.entrySet()) {
            if (pathMatcher.match(entry.getKey(), requestPath)) {
                log.debug("Matched pattern '{}' for path '{}'", entry.getKey(), requestPath);
                return entry.getValue();
            }
        }
        return null;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (!properties.isEnabled() || gates.isEmpty()) {
            return true;
        }
        String path = RequestPaths.routePath(request);
        return properties.getExcludedPaths().stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }
}
