package com.example.hrms.ratelimiter.util;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 프록시/로드밸런서 환경에서 클라이언트 IP 추출
 *
 * 확인 순서:
 * 1. 신뢰하는 엣지 프록시 헤더 (기본값 CF-Connecting-IP)
 * 2. X-Forwarded-For 의 첫 번째 주소 (원래 클라이언트)
 * 3. X-Real-IP
 * 4. 전송 계층 주소 (remoteAddr)
 * 모두 없으면 "unknown"
 */
public class ClientIpResolver {

    public static final String DEFAULT_TRUSTED_PROXY_HEADER = "CF-Connecting-IP";
    public static final String UNKNOWN = "unknown";

    private static final String X_FORWARDED_FOR = "X-Forwarded-For";
    private static final String X_REAL_IP = "X-Real-IP";

    private final String trustedProxyHeader;

    public ClientIpResolver() {
        this(DEFAULT_TRUSTED_PROXY_HEADER);
    }

    public ClientIpResolver(String trustedProxyHeader) {
        this.trustedProxyHeader = trustedProxyHeader;
    }

    public String resolve(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }

        if (hasText(trustedProxyHeader)) {
            String edgeIp = request.getHeader(trustedProxyHeader);
            if (hasText(edgeIp)) {
                return edgeIp.trim();
            }
        }

        String forwardedFor = request.getHeader(X_FORWARDED_FOR);
        if (hasText(forwardedFor)) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        String realIp = request.getHeader(X_REAL_IP);
        if (hasText(realIp)) {
            return realIp.trim();
        }

        String remoteAddr = request.getRemoteAddr();
        return hasText(remoteAddr) ? remoteAddr : UNKNOWN;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
