package com.ryuqq.enginebridge.core.spi;

import java.util.Optional;

/**
 * Native runtime 진입점.
 *
 * <p>프로세스 전체에 policy 등록 슬롯이 하나만 존재합니다. 이미 policy가 등록된 상태에서
 * 다시 등록하면 {@link IllegalStateException}이 발생합니다. 등록 해제는
 * {@link EnvironmentPolicyApi#unregisterPolicy()}로만 가능합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public interface NativeRuntime {

    /**
     * Policy 등록.
     *
     * <p>등록 성공 시 runtime은 {@link EnvironmentPolicy#onPolicyRegistered(EnvironmentPolicyApi)}를
     * 호출합니다. 콜백이 예외를 던지면 등록은 취소되고 예외가 전파됩니다.</p>
     *
     * @param policy 등록할 policy
     * @throws IllegalArgumentException policy가 null인 경우
     * @throws IllegalStateException 이미 다른 policy가 등록된 경우
     */
    void registerPolicy(EnvironmentPolicy policy);

    /**
     * 등록된 policy가 보고하는 현재 environment.
     *
     * @return 현재 environment (없으면 empty)
     * @throws com.ryuqq.enginebridge.core.exception.ConfigurationException 등록된 policy가 없는 경우
     */
    Optional<Environment> currentEnvironment();

    /**
     * 새 core의 기본 worker 수.
     *
     * @return 1 이상
     */
    int availableWorkers();
}
