package com.ryuqq.enginebridge.adapter.inmemory.runtime;

import com.ryuqq.enginebridge.core.model.EnvironmentData;
import com.ryuqq.enginebridge.core.spi.Environment;
import com.ryuqq.enginebridge.core.spi.EnvironmentPolicy;
import com.ryuqq.enginebridge.core.spi.EnvironmentPolicyApi;
import com.ryuqq.enginebridge.core.spi.NativeCore;

/**
 * 등록된 policy에 전달되는 runtime API.
 *
 * <p>한 번의 등록에 하나씩 생성되며, 등록 해제 후에는 unregisterPolicy()가 실패합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class InMemoryPolicyApi implements EnvironmentPolicyApi {

    private final InMemoryNativeRuntime runtime;
    private final EnvironmentPolicy policy;

    InMemoryPolicyApi(InMemoryNativeRuntime runtime, EnvironmentPolicy policy) {
        this.runtime = runtime;
        this.policy = policy;
    }

    @Override
    public EnvironmentData createEnvironment() {
        return runtime.createEnvironment();
    }

    @Override
    public Environment wrapEnvironment(EnvironmentData data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        return new InMemoryEnvironment(data, runtime);
    }

    @Override
    public void destroyEnvironment(EnvironmentData data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        runtime.destroyEnvironment(data);
    }

    @Override
    public boolean isAlive(EnvironmentData data) {
        return runtime.isAlive(data);
    }

    @Override
    public NativeCore coreOf(EnvironmentData data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        return runtime.coreOf(data);
    }

    @Override
    public void unregisterPolicy() {
        runtime.unregisterPolicy(policy);
    }
}
