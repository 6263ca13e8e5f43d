package com.ryuqq.enginebridge.adapter.inmemory.runtime;

import com.ryuqq.enginebridge.core.exception.ConfigurationException;
import com.ryuqq.enginebridge.core.exception.DeadEnvironmentException;
import com.ryuqq.enginebridge.core.model.EnvironmentData;
import com.ryuqq.enginebridge.core.spi.Environment;
import com.ryuqq.enginebridge.core.spi.EnvironmentPolicy;
import com.ryuqq.enginebridge.core.spi.EnvironmentScope;

/**
 * {@link EnvironmentData}의 runtime wrapper.
 *
 * <p>{@link #use()}는 현재 등록된 policy를 통해 environment를 전환하고,
 * scope를 닫으면 직전 environment로 되돌립니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class InMemoryEnvironment implements Environment {

    private final EnvironmentData data;
    private final InMemoryNativeRuntime runtime;

    InMemoryEnvironment(EnvironmentData data, InMemoryNativeRuntime runtime) {
        this.data = data;
        this.runtime = runtime;
    }

    @Override
    public EnvironmentData data() {
        return data;
    }

    /**
     * {@inheritDoc}
     *
     * @throws DeadEnvironmentException environment가 이미 destroy된 경우
     * @throws ConfigurationException 등록된 policy가 없는 경우
     */
    @Override
    public EnvironmentScope use() {
        if (!isAlive()) {
            throw new DeadEnvironmentException(data);
        }
        EnvironmentPolicy policy = runtime.registeredPolicy();
        if (policy == null) {
            throw new ConfigurationException("No environment policy is registered");
        }

        EnvironmentData previous = policy.getCurrentEnvironment();
        policy.setEnvironment(data);
        return () -> policy.setEnvironment(previous);
    }

    @Override
    public boolean isAlive() {
        return runtime.isAlive(data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InMemoryEnvironment)) {
            return false;
        }
        return data == ((InMemoryEnvironment) o).data;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(data);
    }

    @Override
    public String toString() {
        return "InMemoryEnvironment{" + data + "}";
    }
}
