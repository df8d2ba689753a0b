package com.example.hrms.ratelimiter.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.util.UrlPathHelper;

/**
 * 요청 경로 정규화
 *
 * 파티션 키와 URL 패턴 매칭은 Spring MVC가 핸들러를 찾을 때와 같은 경로를 사용해야 합니다.
 * 원본 URI를 그대로 쓰면 {@code /login;x=1}, {@code /%6Cogin} 처럼 같은 핸들러로 가는 요청이
 * 서로 다른 쿼터를 갖게 됩니다.
 */
public final class RequestPaths {

    private static final UrlPathHelper PATH_HELPER = createPathHelper();

    private RequestPaths() {
    }

    /**
     * 컨텍스트 경로를 제외하고 디코딩과 세미콜론(매트릭스 변수, jsessionid) 제거를 거친 경로
     */
    public static String routePath(HttpServletRequest request) {
        return PATH_HELPER.getPathWithinApplication(request);
    }

    private static UrlPathHelper createPathHelper() {
        UrlPathHelper helper = new UrlPathHelper();
        helper.setUrlDecode(true);
        helper.setRemoveSemicolonContent(true);
        return helper;
    }
}
