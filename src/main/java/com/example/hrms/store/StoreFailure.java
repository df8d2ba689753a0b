package com.example.hrms.store;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisConnectionException;
import io.lettuce.core.RedisNoScriptException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.net.ConnectException;
import java.util.concurrent.TimeoutException;

/**
 * Redis 호출 실패 분류
 *
 * 실패 종류마다 fail-open 정책을 명시적으로 적용하기 위한 닫힌 집합입니다.
 */
public enum StoreFailure {

    UNREACHABLE,     // 연결 불가, 서킷 브레이커 open
    TIMEOUT,         // 명령 타임아웃
    SCRIPT_MISSING,  // NOSCRIPT - 서버 스크립트 캐시에서 제거됨
    OTHER;

    private static final String NO_SCRIPT_PREFIX = "NOSCRIPT";

    /**
     * 연결 계열 실패인지 여부 (서킷 브레이커가 기록하는 실패)
     */
    public boolean isConnectivity() {
        return this == UNREACHABLE || this == TIMEOUT;
    }

    /**
     * 예외의 cause 체인을 따라가며 실패 종류를 판별합니다.
     * NOSCRIPT가 가장 우선이며, 그 다음 연결 불가, 타임아웃 순서입니다.
     */
    public static StoreFailure classify(Throwable error) {
        StoreFailure found = OTHER;
        for (Throwable current = error; current != null; current = nextCause(current)) {
            if (current instanceof RedisNoScriptException || startsWithNoScript(current.getMessage())) {
                return SCRIPT_MISSING;
            }
            if (found == OTHER) {
                if (current instanceof RedisConnectionFailureException
                        || current instanceof RedisConnectionException
                        || current instanceof CallNotPermittedException
                        || current instanceof ConnectException) {
                    found = UNREACHABLE;
                } else if (current instanceof QueryTimeoutException
                        || current instanceof RedisCommandTimeoutException
                        || current instanceof TimeoutException) {
                    found = TIMEOUT;
                }
            }
        }
        return found;
    }

    private static Throwable nextCause(Throwable current) {
        Throwable cause = current.getCause();
        return cause == current ? null : cause;
    }

    private static boolean startsWithNoScript(String message) {
        return message != null && message.startsWith(NO_SCRIPT_PREFIX);
    }
}
