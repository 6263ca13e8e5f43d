package com.ryuqq.enginebridge.core.spi;

import com.ryuqq.enginebridge.core.model.EnvironmentData;

/**
 * Runtime의 environment 래퍼.
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public interface Environment {

    /**
     * @return 감싸고 있는 핸들
     */
    EnvironmentData data();

    /**
     * Scoped 활성화.
     *
     * <p>등록된 policy를 통해 이 environment를 활성화하고, 반환된 scope가 닫히면
     * 직전 environment로 복원합니다.</p>
     *
     * <pre>
     * try (EnvironmentScope ignored = environment.use()) {
     *     // this environment is active
     * }
     * </pre>
     *
     * @return 닫으면 이전 environment를 복원하는 scope
     * @throws com.ryuqq.enginebridge.core.exception.DeadEnvironmentException 파괴된 environment인 경우
     */
    EnvironmentScope use();

    /**
     * @return 파괴되지 않았으면 true
     */
    boolean isAlive();
}
