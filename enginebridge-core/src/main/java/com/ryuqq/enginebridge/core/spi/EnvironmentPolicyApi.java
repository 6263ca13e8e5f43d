package com.ryuqq.enginebridge.core.spi;

import com.ryuqq.enginebridge.core.model.EnvironmentData;

/**
 * 등록된 policy에게만 제공되는 runtime API.
 *
 * <p>policy가 해제된 뒤 호출하면 {@link IllegalStateException}이 발생합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public interface EnvironmentPolicyApi {

    /**
     * 새 environment (및 1:1 core) 생성.
     */
    EnvironmentData createEnvironment();

    /**
     * 핸들을 Environment 래퍼로 감쌈.
     */
    Environment wrapEnvironment(EnvironmentData data);

    /**
     * Environment 파괴.
     *
     * <p>core 자체는 해제하지 않습니다. core 회수는 hospice의 몫입니다.</p>
     */
    void destroyEnvironment(EnvironmentData data);

    /**
     * @return environment가 파괴되지 않았으면 true
     */
    boolean isAlive(EnvironmentData data);

    /**
     * Environment에 속한 core 조회.
     *
     * @throws IllegalArgumentException 알 수 없는 environment인 경우
     */
    NativeCore coreOf(EnvironmentData data);

    /**
     * 현재 policy 등록 해제.
     */
    void unregisterPolicy();
}
