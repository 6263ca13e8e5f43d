package com.ryuqq.enginebridge.core.spi;

import com.ryuqq.enginebridge.core.model.EnvironmentData;

/**
 * Runtime이 "현재 environment"를 질의하는 중재자.
 *
 * <p>runtime은 임의의 native worker thread에서 이 인터페이스를 호출합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public interface EnvironmentPolicy {

    /**
     * 등록 성공 콜백.
     *
     * @param api 등록된 동안만 유효한 특권 API
     */
    void onPolicyRegistered(EnvironmentPolicyApi api);

    /**
     * 등록 해제 콜백.
     */
    void onPolicyCleared();

    /**
     * 현재 실행 컨텍스트의 environment.
     *
     * @return 현재 environment 또는 null
     */
    EnvironmentData getCurrentEnvironment();

    /**
     * 현재 실행 컨텍스트의 environment 설정.
     *
     * @param environment 설정할 environment (null이면 해제)
     */
    void setEnvironment(EnvironmentData environment);

    /**
     * Environment가 아직 살아있는지 확인.
     *
     * @param environment 확인할 environment
     * @return 살아있으면 true
     */
    boolean isAlive(EnvironmentData environment);
}
