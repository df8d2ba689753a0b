package com.example.hrms.auth;

/**
 * 자격 증명 폐기 검사 결과
 */
public enum RevocationStatus {
    ACTIVE,            // 유효
    TOKEN_REVOKED,     // 해당 토큰이 개별 폐기됨 (로그아웃 등)
    IDENTITY_REVOKED   // 사용자 전체 세션이 폐기된 이후 발급되지 않은 토큰
}
