package com.ryuqq.enginebridge.adapter.inmemory.runtime;

import com.ryuqq.enginebridge.core.spi.CoreHold;
import com.ryuqq.enginebridge.core.spi.NativeCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool 기반 core.
 *
 * <p><strong>hold 규칙:</strong></p>
 * <ul>
 *   <li>{@link #retain()}이 반환한 hold는 닫힐 때까지 계산됩니다</li>
 *   <li>{@link #request(Callable)}로 제출된 작업은 끝날 때까지 hold를 하나 잡습니다</li>
 *   <li>{@link #free()} 이후의 request는 실패한 future를, retain은 예외를 반환합니다</li>
 * </ul>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class InMemoryCore implements NativeCore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCore.class);

    private final long id;
    private final int workerCount;
    private final ExecutorService workers;
    private final AtomicInteger holds = new AtomicInteger();
    private final AtomicBoolean freed = new AtomicBoolean();

    InMemoryCore(long id, int workerCount) {
        this.id = id;
        this.workerCount = workerCount;
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable, "enginebridge-core-" + id + "-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public int workerCount() {
        return workerCount;
    }

    @Override
    public <T> CompletableFuture<T> request(Callable<T> work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }

        CoreHold hold;
        try {
            hold = retain();
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            workers.execute(() -> {
                // hold is released before the result completes
                T value;
                try {
                    value = work.call();
                } catch (Throwable t) {
                    hold.close();
                    result.completeExceptionally(t);
                    return;
                }
                hold.close();
                result.complete(value);
            });
        } catch (RejectedExecutionException e) {
            hold.close();
            result.completeExceptionally(new IllegalStateException("Core " + id + " is freed", e));
        }
        return result;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException core가 이미 해제된 경우
     */
    @Override
    public CoreHold retain() {
        if (freed.get()) {
            throw new IllegalStateException("Core " + id + " is freed");
        }
        holds.incrementAndGet();
        AtomicBoolean released = new AtomicBoolean();
        return () -> {
            if (released.compareAndSet(false, true)) {
                holds.decrementAndGet();
            }
        };
    }

    @Override
    public int outstandingHolds() {
        return holds.get();
    }

    @Override
    public void free() {
        if (!freed.compareAndSet(false, true)) {
            return;
        }
        workers.shutdown();
        log.debug("Freed core {} ({} holds outstanding)", id, holds.get());
    }

    @Override
    public boolean isFreed() {
        return freed.get();
    }

    @Override
    public String toString() {
        return "InMemoryCore{id=" + id + ", workers=" + workerCount + ", holds=" + holds.get() + "}";
    }
}
