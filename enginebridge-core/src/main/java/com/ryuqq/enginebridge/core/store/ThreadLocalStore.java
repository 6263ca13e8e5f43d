package com.ryuqq.enginebridge.core.store;

import com.ryuqq.enginebridge.core.model.EnvironmentData;

import java.lang.ref.WeakReference;

/**
 * 스레드별 슬롯을 사용하는 store.
 *
 * <p>새 스레드는 값을 상속받지 않습니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class ThreadLocalStore implements EnvironmentStore {

    private final ThreadLocal<WeakReference<EnvironmentData>> current = new ThreadLocal<>();

    @Override
    public WeakReference<EnvironmentData> getCurrentEnvironment() {
        return current.get();
    }

    @Override
    public void setCurrentEnvironment(WeakReference<EnvironmentData> environment) {
        if (environment == null) {
            current.remove();
        } else {
            current.set(environment);
        }
    }
}
