package com.ryuqq.enginebridge.core.store;

import com.ryuqq.enginebridge.core.model.EnvironmentData;

import java.lang.ref.WeakReference;

/**
 * 현재 실행 컨텍스트의 environment 보관소.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>컨텍스트당 값은 최대 하나</li>
 *   <li>서로 무관한 컨텍스트는 서로의 값을 볼 수 없음</li>
 * </ul>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public interface EnvironmentStore {

    /**
     * @return 현재 컨텍스트의 environment 참조 (없으면 null)
     */
    WeakReference<EnvironmentData> getCurrentEnvironment();

    /**
     * 현재 컨텍스트의 environment 참조 설정.
     *
     * @param environment 새 참조 (null이면 해제)
     */
    void setCurrentEnvironment(WeakReference<EnvironmentData> environment);
}
