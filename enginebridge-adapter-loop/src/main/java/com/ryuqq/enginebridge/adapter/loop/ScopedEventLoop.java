package com.ryuqq.enginebridge.adapter.loop;

import com.ryuqq.enginebridge.core.loop.CancellationToken;
import com.ryuqq.enginebridge.core.loop.CapturedContext;
import com.ryuqq.enginebridge.core.loop.EventLoops;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;

/**
 * {@link TaskScope}에 묶인 loop.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>attach(): scope가 닫혔거나 취소되었으면 실패</li>
 *   <li>detach(): scope 취소. 이후 모든 loop 작업의 continuation은 취소로 끝남</li>
 *   <li>toThread(): scope 작업으로 실행하며, 동시 실행 수는
 *       {@link LoopConfig#workerThreads()}로 제한</li>
 * </ul>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class ScopedEventLoop extends RunLoopEventLoop {

    private final TaskScope scope;
    private final Semaphore limiter;

    public ScopedEventLoop(TaskScope scope) {
        this(scope, new LoopConfig());
    }

    public ScopedEventLoop(TaskScope scope, LoopConfig config) {
        super(config);
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        this.scope = scope;
        this.limiter = new Semaphore(config.workerThreads());
    }

    public TaskScope scope() {
        return scope;
    }

    @Override
    protected void onAttach() {
        if (!scope.isOpen() || scope.isCancelled()) {
            throw new IllegalStateException("Cannot attach to a task scope that is not open: " + scope);
        }
    }

    @Override
    protected void onDetach() {
        scope.cancel();
    }

    @Override
    protected boolean isCancelled(CancellationToken token) {
        return scope.isCancelled() || super.isCancelled(token);
    }

    @Override
    public <T> CompletableFuture<T> toThread(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        CapturedContext context = EventLoops.captureContext();
        CompletableFuture<T> done;
        try {
            done = scope.spawn(() -> {
                limiter.acquire();
                try {
                    return context.call(task);
                } finally {
                    limiter.release();
                }
            });
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }
        return awaitFuture(done);
    }

    /**
     * @return 지금 toThread() 작업에 쓸 수 있는 자리 수
     */
    public int availableWorkerSlots() {
        return limiter.availablePermits();
    }

    @Override
    public String toString() {
        return "ScopedEventLoop{" + scope + "}";
    }
}
