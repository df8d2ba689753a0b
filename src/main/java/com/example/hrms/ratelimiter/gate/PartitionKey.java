package com.example.hrms.ratelimiter.gate;

/**
 * 쿼터를 공유하는 단위를 나타내는 파티션 키 생성
 *
 * 형식: {prefix}:{경로의 '/'를 '_'로 바꾼 값}:{ip:주소 | user:아이디}
 * 여러 인스턴스가 같은 Redis를 공유하므로 형식을 바꾸면 안 됩니다.
 */
public final class PartitionKey {

    private PartitionKey() {
    }

    public static String of(String keyPrefix, String routePath, String identity) {
        return keyPrefix + ":" + normalizePath(routePath) + ":" + identity;
    }

    public static String normalizePath(String routePath) {
        if (routePath == null || routePath.isEmpty()) {
            return "_";
        }
        return routePath.replace('/', '_');
    }

    public static String ipIdentity(String clientIp) {
        return "ip:" + clientIp;
    }

    public static String userIdentity(String userId) {
        return "user:" + userId;
    }
}
