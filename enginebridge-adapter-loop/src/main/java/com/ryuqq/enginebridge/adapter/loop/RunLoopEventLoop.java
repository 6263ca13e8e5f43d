package com.ryuqq.enginebridge.adapter.loop;

import com.ryuqq.enginebridge.core.loop.CancellationToken;
import com.ryuqq.enginebridge.core.loop.CapturedContext;
import com.ryuqq.enginebridge.core.loop.EventLoop;
import com.ryuqq.enginebridge.core.loop.EventLoops;
import com.ryuqq.enginebridge.core.loop.LoopCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * {@link RunLoop} 위에서 동작하는 EventLoop 공통 구현.
 *
 * <p><strong>작업과 취소:</strong></p>
 * <ul>
 *   <li>{@link #fromThread(Callable)}로 등록된 작업마다 {@link CancellationToken}이 하나 생성됩니다</li>
 *   <li>{@link #nextCycle()}, {@link #awaitFuture(CompletableFuture)}의 continuation은
 *       호출한 작업의 token을 이어받습니다</li>
 *   <li>반환된 future를 cancel하면 token이 취소되고, 아직 실행되지 않은 작업은 건너뜁니다</li>
 *   <li>취소된 작업의 continuation은 {@link LoopCancelledException}으로 실패합니다</li>
 * </ul>
 *
 * <p><strong>context:</strong> {@link #fromThread(Callable)}에 넘긴 작업은 호출 시점의 context
 * ({@link EventLoops#captureContext()}, 현재 environment 포함)에서 loop 스레드로 실행됩니다.</p>
 *
 * <p>attach()마다 새 {@link RunLoop}을 시작하고 detach()에서 멈춥니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public abstract class RunLoopEventLoop implements EventLoop {

    private static final Logger log = LoggerFactory.getLogger(RunLoopEventLoop.class);

    protected final LoopConfig config;

    private final Object lifecycleLock = new Object();
    private volatile RunLoop runLoop;

    protected RunLoopEventLoop(LoopConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException 이미 attach된 경우
     */
    @Override
    public void attach() {
        synchronized (lifecycleLock) {
            if (runLoop != null) {
                throw new IllegalStateException(this + " is already attached");
            }
            onAttach();
            RunLoop loop = new RunLoop(config.threadName());
            loop.start();
            runLoop = loop;
        }
        log.info("Attached {}", this);
    }

    @Override
    public void detach() {
        RunLoop loop;
        synchronized (lifecycleLock) {
            loop = runLoop;
            if (loop == null) {
                return;
            }
            runLoop = null;
        }
        try {
            onDetach();
        } finally {
            loop.stop(config.shutdownTimeoutMs());
        }
        log.info("Detached {}", this);
    }

    /**
     * RunLoop 시작 직전에 호출. 예외를 던지면 attach가 실패합니다.
     */
    protected void onAttach() {
    }

    /**
     * RunLoop 정지 직전에 호출.
     */
    protected void onDetach() {
    }

    /**
     * 새 작업의 token.
     */
    protected CancellationToken newTaskToken() {
        return new CancellationToken();
    }

    /**
     * 작업이 취소되었는지 판단.
     */
    protected boolean isCancelled(CancellationToken token) {
        return token.isCancelled();
    }

    @Override
    public <T> CompletableFuture<T> fromThread(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }

        CapturedContext context = EventLoops.captureContext();
        CompletableFuture<T> result = new CompletableFuture<>();
        CancellationToken token = newTaskToken();
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                token.cancel();
            }
        });

        LoopTask loopTask = new LoopTask(() -> {
            if (result.isDone()) {
                return;
            }
            if (isCancelled(token)) {
                result.completeExceptionally(new LoopCancelledException());
                return;
            }
            try {
                result.complete(context.call(task));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        }, token, () -> result.completeExceptionally(stopped()));

        if (!post(loopTask)) {
            result.completeExceptionally(notAttached());
        }
        return result;
    }

    /**
     * {@inheritDoc}
     *
     * <p>다음 loop 차례에 완료됩니다. 호출한 작업이 그 사이 취소되었으면
     * {@link LoopCancelledException}으로 실패합니다.</p>
     */
    @Override
    public CompletableFuture<Void> nextCycle() {
        CancellationToken token = callerToken();
        CompletableFuture<Void> next = new CompletableFuture<>();

        LoopTask continuation = new LoopTask(() -> {
            if (isCancelled(token)) {
                next.completeExceptionally(new LoopCancelledException());
            } else {
                next.complete(null);
            }
        }, token, () -> next.completeExceptionally(stopped()));

        if (!post(continuation)) {
            next.completeExceptionally(notAttached());
        }
        return next;
    }

    /**
     * {@inheritDoc}
     *
     * <p>결과는 loop 스레드에서 전달됩니다.</p>
     */
    @Override
    public <T> CompletableFuture<T> awaitFuture(CompletableFuture<T> future) {
        if (future == null) {
            throw new IllegalArgumentException("future cannot be null");
        }

        CancellationToken token = callerToken();
        CompletableFuture<T> result = new CompletableFuture<>();
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                future.cancel(false);
            }
        });

        future.whenComplete((value, error) -> {
            LoopTask delivery = new LoopTask(() -> {
                if (isCancelled(token)) {
                    result.completeExceptionally(new LoopCancelledException());
                } else if (error != null) {
                    result.completeExceptionally(error);
                } else {
                    result.complete(value);
                }
            }, token, () -> result.completeExceptionally(stopped()));

            if (!post(delivery)) {
                result.completeExceptionally(stopped());
            }
        });
        return result;
    }

    @Override
    public void throwIfCancelled() {
        LoopTask task = currentTask();
        if (task != null && isCancelled(task.token())) {
            throw new LoopCancelledException();
        }
    }

    /**
     * @return 현재 loop 작업의 token (loop 스레드 밖에서는 null)
     */
    public CancellationToken currentToken() {
        LoopTask task = currentTask();
        return task == null ? null : task.token();
    }

    /**
     * @return 호출 스레드가 loop 스레드이면 true
     */
    public boolean isLoopThread() {
        RunLoop loop = runLoop;
        return loop != null && loop.isLoopThread();
    }

    public boolean isAttached() {
        return runLoop != null;
    }

    protected boolean post(LoopTask task) {
        RunLoop loop = runLoop;
        return loop != null && loop.post(task);
    }

    private LoopTask currentTask() {
        RunLoop loop = runLoop;
        return loop == null ? null : loop.currentTask();
    }

    private CancellationToken callerToken() {
        LoopTask caller = currentTask();
        return caller != null ? caller.token() : newTaskToken();
    }

    protected IllegalStateException notAttached() {
        return new IllegalStateException(this + " is not attached");
    }

    private static LoopCancelledException stopped() {
        return new LoopCancelledException("Event loop was stopped");
    }
}
