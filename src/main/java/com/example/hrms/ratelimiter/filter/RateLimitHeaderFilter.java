package com.example.hrms.ratelimiter.filter;

import com.example.hrms.ratelimiter.core.RateLimitAttributes;
import com.example.hrms.ratelimiter.core.RateLimitDecision;
import com.example.hrms.ratelimiter.util.ResponseUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;

/**
 * 모든 응답에 Rate Limit 헤더를 붙이는 필터
 *
 * Admission Gate와 분리되어 있어 라우트가 제한을 강제하는지와 관계없이 동작합니다.
 * 컨트롤러가 응답을 커밋한 뒤에도 헤더를 쓸 수 있도록 본문을 버퍼링합니다.
 */
public class RateLimitHeaderFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        try {
            filterChain.doFilter(request, wrapper);
        } finally {
            if (request.getAttribute(RateLimitAttributes.DECISION) instanceof RateLimitDecision decision) {
                ResponseUtil.setRateLimitHeaders(wrapper, decision);
            }
            wrapper.copyBodyToResponse();
        }
    }
}
