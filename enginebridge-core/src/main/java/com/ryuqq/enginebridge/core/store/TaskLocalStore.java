package com.ryuqq.enginebridge.core.store;

import com.ryuqq.enginebridge.core.context.TaskLocal;
import com.ryuqq.enginebridge.core.model.EnvironmentData;

import java.lang.ref.WeakReference;

/**
 * 논리적 task별 슬롯을 사용하는 store.
 *
 * <p>값은 {@link com.ryuqq.enginebridge.core.context.TaskContext}에 저장됩니다.
 * 자식 task는 spawn 시점의 값을 상속받고, 이후 변경은 형제 task 사이에 공유되지 않습니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class TaskLocalStore implements EnvironmentStore {

    private final TaskLocal<Binding> current = new TaskLocal<>("enginebridge.environment", Binding.class);

    @Override
    public WeakReference<EnvironmentData> getCurrentEnvironment() {
        Binding binding = current.get();
        return binding == null ? null : binding.reference();
    }

    @Override
    public void setCurrentEnvironment(WeakReference<EnvironmentData> environment) {
        current.set(environment == null ? null : new Binding(environment));
    }

    private record Binding(WeakReference<EnvironmentData> reference) {
    }
}
