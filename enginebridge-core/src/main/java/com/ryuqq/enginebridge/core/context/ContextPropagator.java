package com.ryuqq.enginebridge.core.context;

import com.ryuqq.enginebridge.core.spi.EnvironmentScope;

/**
 * 스레드 경계를 넘어 전달해야 하는 추가 상태의 캡처 훅.
 *
 * <p>{@link TaskContext}로 표현되지 않는 상태(예: native runtime의 현재 environment)를
 * 호출 시점에 캡처하고, 실행 시점에 다시 활성화합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ContextPropagator {

    /**
     * 아무것도 전달하지 않는 propagator.
     */
    ContextPropagator NONE = () -> () -> EnvironmentScope.NOOP;

    /**
     * 호출 스레드의 상태 캡처.
     *
     * <p>예외를 던지지 않아야 합니다. 캡처할 상태가 없으면 no-op activation을 반환합니다.</p>
     *
     * @return 실행 스레드에서 상태를 다시 활성화하는 activation
     */
    Activation capture();

    /**
     * 캡처된 상태의 재활성화.
     */
    @FunctionalInterface
    interface Activation {

        /**
         * @return 닫으면 실행 스레드의 이전 상태를 복원하는 scope
         */
        EnvironmentScope activate();
    }
}
