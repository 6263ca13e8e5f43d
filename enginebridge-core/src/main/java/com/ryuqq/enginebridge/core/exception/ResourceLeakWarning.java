package com.ryuqq.enginebridge.core.exception;

/**
 * 명시적 해제 없이 회수된 자원에 대한 진단.
 *
 * <p>던지지 않고 경고 로그의 throwable로만 사용합니다 (생성 위치 stack trace 보존).</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public class ResourceLeakWarning extends RuntimeException {

    public ResourceLeakWarning(String message) {
        super(message);
    }
}
