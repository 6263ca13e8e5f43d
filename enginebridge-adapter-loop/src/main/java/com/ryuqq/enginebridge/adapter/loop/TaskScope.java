package com.ryuqq.enginebridge.adapter.loop;

import com.ryuqq.enginebridge.core.context.TaskContext;
import com.ryuqq.enginebridge.core.loop.CancellationToken;
import com.ryuqq.enginebridge.core.loop.LoopCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 구조적 동시성 scope.
 *
 * <p>scope 안에서 시작된 작업은 scope보다 오래 살지 않습니다:</p>
 * <ul>
 *   <li>{@link #spawn(Callable)}: 새 스레드에서 작업 실행. 호출 시점의 {@link TaskContext}를 상속</li>
 *   <li>{@link #cancel()}: scope token 취소 후 실행 중인 작업 스레드 인터럽트</li>
 *   <li>{@link #close()}: 새 작업을 막고 모든 작업이 끝날 때까지 대기</li>
 * </ul>
 *
 * <p>spawn과 close는 같은 lock으로 직렬화됩니다. close가 반환되면 그 전에 시작된 작업은 모두
 * 끝났고, 이후의 spawn은 실패합니다. {@link #token()}을 직접 취소해도 작업 스레드가 인터럽트됩니다.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (TaskScope scope = TaskScope.open("render")) {
 *     CompletableFuture&lt;Frame&gt; frame = scope.spawn(() -&gt; core.request(work).get());
 *     ...
 * } // 모든 작업 종료 후 반환
 * </pre>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class TaskScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskScope.class);

    private final String name;
    private final CancellationToken token = new CancellationToken();
    private final Object lock = new Object();
    private final AtomicLong taskIds = new AtomicLong();
    private final Map<CompletableFuture<?>, Thread> children = new ConcurrentHashMap<>();
    private volatile boolean closed;

    private TaskScope(String name) {
        this.name = name;
        token.onCancel(this::interruptChildren);
    }

    public static TaskScope open() {
        return open("scope");
    }

    public static TaskScope open(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return new TaskScope(name);
    }

    /**
     * scope 안에서 작업 실행.
     *
     * @return 작업 결과. scope가 이미 취소되었으면 {@link LoopCancelledException}으로 실패
     * @throws IllegalStateException scope가 닫힌 경우
     */
    public <T> CompletableFuture<T> spawn(Callable<T> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        TaskContext context = TaskContext.capture();
        Thread thread = new Thread(() -> {
            try {
                T value = context.call(task);
                children.remove(result);
                result.complete(value);
            } catch (Throwable t) {
                children.remove(result);
                result.completeExceptionally(t);
            }
        }, name + "-task-" + taskIds.incrementAndGet());
        thread.setDaemon(true);

        synchronized (lock) {
            ensureOpen();
            if (token.isCancelled()) {
                return CompletableFuture.failedFuture(new LoopCancelledException("Task scope " + name + " is cancelled"));
            }
            children.put(result, thread);
            thread.start();
        }
        return result;
    }

    /**
     * scope 취소.
     *
     * @return 이 호출이 취소했으면 true
     */
    public boolean cancel() {
        return token.cancel();
    }

    public CancellationToken token() {
        return token;
    }

    public boolean isOpen() {
        return !closed;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    /**
     * @return 실행 중인 작업 수
     */
    public int activeCount() {
        return children.size();
    }

    /**
     * 새 작업을 막고 실행 중인 작업이 모두 끝날 때까지 대기.
     *
     * <p>작업의 실패는 각 작업의 future로만 전달됩니다.</p>
     */
    @Override
    public void close() {
        CompletableFuture<?>[] running;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            running = children.keySet().toArray(new CompletableFuture<?>[0]);
        }
        CompletableFuture.allOf(running).handle((value, error) -> null).join();
        log.debug("Task scope {} closed", name);
    }

    private void interruptChildren() {
        synchronized (lock) {
            for (Thread thread : children.values()) {
                thread.interrupt();
            }
        }
        log.debug("Task scope {} cancelled ({} tasks running)", name, children.size());
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Task scope " + name + " is closed");
        }
    }

    @Override
    public String toString() {
        return "TaskScope{" + name + ", cancelled=" + token.isCancelled() + "}";
    }
}
