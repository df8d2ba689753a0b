package com.example.hrms.auth;

import com.example.hrms.store.RedisStore;
import com.example.hrms.store.StoreFailure;
import com.example.hrms.util.HashUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Redis 기반 토큰 폐기 저장소 (로그아웃, 계정 탈취 대응)
 *
 * 키 형식:
 * <ul>
 *   <li>토큰 폐기: {@code token:revoked:{sha256(token)}} = "1", TTL = 토큰 남은 유효 시간</li>
 *   <li>사용자 전체 폐기: {@code user:revoked:{identity}} = 폐기 시각 (epoch 초)</li>
 * </ul>
 * 여러 인스턴스가 같은 Redis를 공유하므로 키 형식을 바꾸면 안 됩니다.
 *
 * <p>장애 정책:
 * <ul>
 *   <li>조회는 fail-open - Redis 장애 중에는 폐기되지 않은 것으로 판단 (가용성 우선)</li>
 *   <li>폐기 요청은 예외 대신 false를 반환하여 호출자가 재시도할 수 있게 함</li>
 * </ul>
 */
@Slf4j
public class TokenRevocationStore {

    public static final String TOKEN_PREFIX = "token:revoked:";
    public static final String IDENTITY_PREFIX = "user:revoked:";
    public static final Duration DEFAULT_IDENTITY_REVOCATION_TTL = Duration.ofHours(24);

    private static final String REVOKED_VALUE = "1";

    private final RedisStore store;
    private final Clock clock;
    private final ReentrantLock connectLock = new ReentrantLock();
    private volatile boolean connected;

    public TokenRevocationStore(RedisStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * 연결을 확인합니다. 다른 스레드가 이미 연결 중이면 기다리지 않고 반환합니다.
     */
    public void connect() {
        if (connected || !connectLock.tryLock()) {
            return;
        }
        try {
            if (connected) {
                return;
            }
            store.ping();
            connected = true;
            log.info("Token revocation store connected to Redis");
        } catch (RuntimeException e) {
            log.error("Failed to connect token revocation store ({}): {}", StoreFailure.classify(e), e.getMessage());
            connected = false;
        } finally {
            connectLock.unlock();
        }
    }

    public void close() {
        connectLock.lock();
        try {
            connected = false;
        } finally {
            connectLock.unlock();
        }
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * 토큰을 자연 만료 시각까지 폐기 목록에 추가합니다.
     * 이미 만료된 토큰은 저장하지 않고 성공으로 처리합니다.
     *
     * @return 저장 성공 또는 저장이 필요 없는 경우 true, Redis를 사용할 수 없으면 false
     */
    public boolean revoke(String credential, Instant naturalExpiry) {
        long ttlSeconds = naturalExpiry.getEpochSecond() - clock.instant().getEpochSecond();
        if (ttlSeconds <= 0) {
            log.debug("Token already expired, skipping revocation");
            return true;
        }

        if (!ensureConnected()) {
            log.warn("Cannot revoke token - Redis unavailable");
            return false;
        }

        try {
            store.setex(tokenKey(credential), REVOKED_VALUE, Duration.ofSeconds(ttlSeconds));
            log.debug("Token revoked with TTL {}s", ttlSeconds);
            return true;
        } catch (RuntimeException e) {
            logFailure("token revocation", e);
            return false;
        }
    }

    /**
     * 토큰 폐기 여부. Redis를 사용할 수 없으면 false (fail-open)
     */
    public boolean isRevoked(String credential) {
        if (!ensureConnected()) {
            log.warn("Token revocation store unavailable - failing open");
            return false;
        }

        try {
            return store.exists(tokenKey(credential));
        } catch (RuntimeException e) {
            logFailure("revocation check", e);
            return false;
        }
    }

    /**
     * 사용자의 모든 토큰을 폐기합니다 (비밀번호 변경, 계정 탈취 등)
     * 현재 시각을 기록하여 그 이전에 발급된 토큰을 모두 무효화합니다.
     */
    public boolean revokeAllForIdentity(String identity, Duration ttl) {
        if (!ensureConnected()) {
            log.warn("Cannot revoke tokens for identity - Redis unavailable");
            return false;
        }

        try {
            String revokedAt = String.valueOf(clock.instant().getEpochSecond());
            store.setex(identityKey(identity), revokedAt, ttl);
            log.info("All tokens revoked for identity {}", identity);
            return true;
        } catch (RuntimeException e) {
            logFailure("identity revocation", e);
            return false;
        }
    }

    public boolean revokeAllForIdentity(String identity) {
        return revokeAllForIdentity(identity, DEFAULT_IDENTITY_REVOCATION_TTL);
    }

    /**
     * 사용자 전체 폐기 이후 발급되지 않은 토큰인지 확인합니다.
     *
     * @param credentialIssuedAt 토큰 발급 시각 (iat, epoch 초)
     * @return 폐기 기록이 있고 발급 시각이 폐기 시각보다 이전이면 true
     */
    public boolean isIdentityRevokedSince(String identity, long credentialIssuedAt) {
        if (!ensureConnected()) {
            return false;
        }

        String revokedAt;
        try {
            revokedAt = store.get(identityKey(identity));
        } catch (RuntimeException e) {
            logFailure("identity revocation check", e);
            return false;
        }

        if (revokedAt == null) {
            return false;
        }
        try {
            return credentialIssuedAt < Long.parseLong(revokedAt.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid identity revocation marker for {}: {}", identity, revokedAt);
            return false;
        }
    }

    /**
     * 개별 폐기와 사용자 전체 폐기를 함께 확인합니다.
     *
     * @param identity 토큰의 사용자 식별자 (sub), 없으면 개별 폐기만 확인
     * @param credentialIssuedAt 발급 시각 (iat), null이면 사용자 전체 폐기는 확인하지 않음
     */
    public RevocationStatus check(String credential, String identity, Long credentialIssuedAt) {
        if (isRevoked(credential)) {
            return RevocationStatus.TOKEN_REVOKED;
        }
        if (identity != null && credentialIssuedAt != null
                && isIdentityRevokedSince(identity, credentialIssuedAt)) {
            return RevocationStatus.IDENTITY_REVOKED;
        }
        return RevocationStatus.ACTIVE;
    }

    static String tokenKey(String credential) {
        return TOKEN_PREFIX + HashUtil.sha256Hex(credential);
    }

    static String identityKey(String identity) {
        return IDENTITY_PREFIX + identity;
    }

    private boolean ensureConnected() {
        if (!connected) {
            connect();
        }
        return connected;
    }

    private void logFailure(String operation, RuntimeException e) {
        StoreFailure failure = StoreFailure.classify(e);
        if (failure.isConnectivity()) {
            log.error("Redis {} during {}: {} - failing open", failure, operation, e.getMessage());
            connected = false;
        } else {
            log.error("Unexpected error during {} - failing open", operation, e);
        }
    }
}
