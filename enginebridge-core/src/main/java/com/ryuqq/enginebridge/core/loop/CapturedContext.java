package com.ryuqq.enginebridge.core.loop;

import com.ryuqq.enginebridge.core.context.ContextPropagator;
import com.ryuqq.enginebridge.core.context.TaskContext;
import com.ryuqq.enginebridge.core.spi.EnvironmentScope;

import java.util.concurrent.Callable;

/**
 * 한 시점에 캡처된 실행 context.
 *
 * <p>{@link TaskContext}와 propagator가 캡처한 상태(현재 environment 등)를 묶어서,
 * 이후 임의의 스레드에서 여러 번 재설치할 수 있습니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 * @see EventLoops#captureContext()
 */
public final class CapturedContext {

    private final TaskContext context;
    private final ContextPropagator.Activation activation;

    CapturedContext(TaskContext context, ContextPropagator.Activation activation) {
        this.context = context;
        this.activation = activation;
    }

    /**
     * 캡처된 context 안에서 작업 실행.
     */
    public <T> T call(Callable<T> task) throws Exception {
        return context.call(() -> {
            try (EnvironmentScope ignored = activation.activate()) {
                return task.call();
            }
        });
    }

    /**
     * 캡처된 context 안에서 작업 실행.
     */
    public void run(Runnable task) {
        context.run(() -> {
            try (EnvironmentScope ignored = activation.activate()) {
                task.run();
            }
        });
    }

    public <T> Callable<T> wrap(Callable<T> task) {
        return () -> call(task);
    }

    public Runnable wrap(Runnable task) {
        return () -> run(task);
    }
}
