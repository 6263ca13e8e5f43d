package com.ryuqq.enginebridge.core.exception;

import com.ryuqq.enginebridge.core.model.EnvironmentData;

/**
 * 이미 파괴된 environment를 활성화하려 할 때 발생.
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public class DeadEnvironmentException extends IllegalStateException {

    private final transient EnvironmentData environment;

    public DeadEnvironmentException(EnvironmentData environment) {
        super("Environment is dead: " + environment);
        this.environment = environment;
    }

    public DeadEnvironmentException(String message) {
        super(message);
        this.environment = null;
    }

    /**
     * @return 원인 environment (알 수 없으면 null)
     */
    public EnvironmentData getEnvironment() {
        return environment;
    }
}
