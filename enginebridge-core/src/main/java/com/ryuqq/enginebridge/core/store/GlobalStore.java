package com.ryuqq.enginebridge.core.store;

import com.ryuqq.enginebridge.core.model.EnvironmentData;

import java.lang.ref.WeakReference;

/**
 * 프로세스 전역 슬롯 하나를 사용하는 store.
 *
 * <p>environment를 하나만 쓰는 애플리케이션용입니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class GlobalStore implements EnvironmentStore {

    private volatile WeakReference<EnvironmentData> current;

    @Override
    public WeakReference<EnvironmentData> getCurrentEnvironment() {
        return current;
    }

    @Override
    public void setCurrentEnvironment(WeakReference<EnvironmentData> environment) {
        this.current = environment;
    }
}
