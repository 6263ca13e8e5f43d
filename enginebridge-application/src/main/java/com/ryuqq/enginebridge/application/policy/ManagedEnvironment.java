package com.ryuqq.enginebridge.application.policy;

import com.ryuqq.enginebridge.core.exception.DeadEnvironmentException;
import com.ryuqq.enginebridge.core.exception.ResourceLeakWarning;
import com.ryuqq.enginebridge.core.model.EnvironmentData;
import com.ryuqq.enginebridge.core.model.EnvironmentState;
import com.ryuqq.enginebridge.core.model.EnvironmentTransition;
import com.ryuqq.enginebridge.core.spi.Environment;
import com.ryuqq.enginebridge.core.spi.EnvironmentScope;
import com.ryuqq.enginebridge.core.spi.NativeCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.concurrent.Callable;

/**
 * Policy가 생성한 environment 하나의 수명 관리.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CREATED → IN_USE (use / switchTo)
 * CREATED | IN_USE → DISPOSED (dispose, 터미널)
 * </pre>
 *
 * <p><strong>dispose:</strong> core를 즉시 해제하지 않고 {@link com.ryuqq.enginebridge.core.hospice.Hospice}에
 * 넘긴 뒤 runtime에서 environment를 destroy합니다. 두 번째 호출부터는 아무것도 하지 않습니다.</p>
 *
 * <p>dispose 없이 도달 불가능해진 인스턴스는 {@link Cleaner}가 {@link ResourceLeakWarning} 경고를
 * 남긴 뒤 dispose합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class ManagedEnvironment implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ManagedEnvironment.class);

    private static final Cleaner CLEANER = Cleaner.create();

    private final Environment environment;
    private final Policy policy;
    private final Lifecycle lifecycle;
    private final Cleaner.Cleanable cleanable;

    ManagedEnvironment(Environment environment, EnvironmentData data, Policy policy) {
        this.environment = environment;
        this.policy = policy;
        this.lifecycle = new Lifecycle(data, policy);
        this.cleanable = CLEANER.register(this, lifecycle);
    }

    /**
     * @return runtime의 environment wrapper
     */
    public Environment environment() {
        return environment;
    }

    /**
     * @return environment handle (dispose 이후에는 null)
     */
    public EnvironmentData data() {
        return lifecycle.data;
    }

    /**
     * @return 이 environment의 core
     * @throws DeadEnvironmentException dispose된 경우
     */
    public NativeCore core() {
        return policy.api().coreOf(lifecycle.requireAlive());
    }

    /**
     * 블록 동안 이 environment를 활성화.
     *
     * <p>반환된 scope를 닫으면 직전 environment로 되돌아갑니다.</p>
     *
     * @throws DeadEnvironmentException dispose된 경우
     */
    public EnvironmentScope use() {
        lifecycle.requireAlive();
        EnvironmentScope scope = environment.use();
        lifecycle.markInUse();
        return scope;
    }

    /**
     * 직전 environment를 기억하지 않고 이 environment로 전환.
     *
     * @throws DeadEnvironmentException dispose된 경우
     */
    public void switchTo() {
        lifecycle.requireAlive();
        environment.use();
        lifecycle.markInUse();
    }

    /**
     * store를 거치지 않고 현재 스레드에서만 이 environment로 body 실행.
     *
     * <p>body 안에서 스레드를 넘기거나 loop에 제어를 돌려주면 안 됩니다.</p>
     */
    public <T> T inlineSection(Callable<T> body) throws Exception {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        EnvironmentData data = lifecycle.requireAlive();
        ManagedPolicy managed = policy.managed();
        EnvironmentData previous = managed.inlineSectionStart(data);
        try {
            return body.call();
        } finally {
            managed.inlineSectionEnd(previous);
        }
    }

    /**
     * Environment 폐기 (멱등).
     */
    public void dispose() {
        lifecycle.dispose();
        cleanable.clean();
    }

    public boolean isDisposed() {
        return lifecycle.state == EnvironmentState.DISPOSED;
    }

    public EnvironmentState state() {
        return lifecycle.state;
    }

    @Override
    public void close() {
        dispose();
    }

    @Override
    public String toString() {
        return "ManagedEnvironment{" + lifecycle.data + ", state=" + lifecycle.state + "}";
    }

    /**
     * Cleaner action 겸 상태 보관소. ManagedEnvironment를 참조하지 않습니다.
     */
    private static final class Lifecycle implements Runnable {

        private final Policy policy;
        private final ResourceLeakWarning allocationSite;

        private volatile EnvironmentData data;
        private volatile EnvironmentState state = EnvironmentState.CREATED;

        private Lifecycle(EnvironmentData data, Policy policy) {
            this.data = data;
            this.policy = policy;
            this.allocationSite = new ResourceLeakWarning("Environment " + data + " was allocated here");
        }

        private EnvironmentData requireAlive() {
            EnvironmentData current = data;
            if (current == null) {
                throw new DeadEnvironmentException("Environment is already disposed");
            }
            return current;
        }

        private synchronized void markInUse() {
            if (state != EnvironmentState.IN_USE) {
                state = EnvironmentTransition.transition(state, EnvironmentState.IN_USE);
            }
        }

        private synchronized void dispose() {
            EnvironmentData current = data;
            if (current == null) {
                return;
            }

            log.debug("Disposing environment {}", current);
            NativeCore core = policy.api().coreOf(current);
            policy.hospice().admit(current, core);
            policy.api().destroyEnvironment(current);
            data = null;
            state = EnvironmentTransition.transition(state, EnvironmentState.DISPOSED);
        }

        @Override
        public void run() {
            if (data == null) {
                return;
            }
            log.warn("Disposing {} from the cleaner. This might cause leaks.", data, allocationSite);
            try {
                dispose();
            } catch (RuntimeException e) {
                log.error("Failed to dispose leaked environment", e);
            }
        }
    }
}
