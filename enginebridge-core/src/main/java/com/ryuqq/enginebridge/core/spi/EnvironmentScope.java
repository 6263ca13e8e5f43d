package com.ryuqq.enginebridge.core.spi;

/**
 * 활성화 범위. 닫으면 이전 environment가 복원됩니다.
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EnvironmentScope extends AutoCloseable {

    /**
     * 아무것도 복원하지 않는 scope.
     */
    EnvironmentScope NOOP = () -> { };

    @Override
    void close();
}
