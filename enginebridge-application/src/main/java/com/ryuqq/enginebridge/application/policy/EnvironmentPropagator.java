package com.ryuqq.enginebridge.application.policy;

import com.ryuqq.enginebridge.core.context.ContextPropagator;
import com.ryuqq.enginebridge.core.exception.ConfigurationException;
import com.ryuqq.enginebridge.core.model.EnvironmentData;
import com.ryuqq.enginebridge.core.spi.Environment;

/**
 * 호출 시점의 environment를 캡처해 다른 스레드에서 scoped 활성화.
 *
 * <p>캡처 시점에 environment가 없거나 policy가 등록 해제된 상태면 아무것도 활성화하지 않습니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class EnvironmentPropagator implements ContextPropagator {

    private final ManagedPolicy managed;

    EnvironmentPropagator(ManagedPolicy managed) {
        this.managed = managed;
    }

    @Override
    public Activation capture() {
        EnvironmentData data = managed.getCurrentEnvironment();
        if (data == null) {
            return NONE.capture();
        }

        Environment environment;
        try {
            environment = managed.api().wrapEnvironment(data);
        } catch (ConfigurationException e) {
            return NONE.capture();
        }
        return environment::use;
    }
}
