package com.ryuqq.enginebridge.adapter.loop;

import com.ryuqq.enginebridge.core.loop.CapturedContext;
import com.ryuqq.enginebridge.core.loop.EventLoops;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 단일 스레드 callback loop.
 *
 * <p>loop 작업은 하나의 스레드에서 순서대로 실행되고, blocking 작업({@link #toThread(Callable)})은
 * {@link LoopConfig#workerThreads()} 크기의 pool에서 호출 시점의 context로 실행된 뒤
 * 결과가 loop 스레드로 돌아옵니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class CallbackEventLoop extends RunLoopEventLoop {

    private volatile ExecutorService workers;

    public CallbackEventLoop() {
        this(new LoopConfig());
    }

    public CallbackEventLoop(LoopConfig config) {
        super(config);
    }

    @Override
    protected void onAttach() {
        AtomicInteger index = new AtomicInteger();
        workers = Executors.newFixedThreadPool(config.workerThreads(), runnable -> {
            Thread thread = new Thread(runnable, config.threadName() + "-worker-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    protected void onDetach() {
        ExecutorService pool = workers;
        workers = null;
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Override
    public <T> CompletableFuture<T> toThread(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        ExecutorService pool = workers;
        if (pool == null) {
            return CompletableFuture.failedFuture(notAttached());
        }

        CapturedContext context = EventLoops.captureContext();
        CompletableFuture<T> done = new CompletableFuture<>();
        try {
            pool.execute(() -> {
                if (done.isDone()) {
                    return;
                }
                try {
                    done.complete(context.call(task));
                } catch (Throwable t) {
                    done.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            done.completeExceptionally(notAttached());
        }
        return awaitFuture(done);
    }

    @Override
    public String toString() {
        return "CallbackEventLoop{" + config.threadName() + "}";
    }
}
