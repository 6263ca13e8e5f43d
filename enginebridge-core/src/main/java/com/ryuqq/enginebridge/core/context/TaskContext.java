package com.ryuqq.enginebridge.core.context;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 논리적 task의 불변 context.
 *
 * <p>스레드마다 현재 설치된 context가 하나 있으며, 설치된 적 없는 스레드는
 * {@link #empty()}를 봅니다. {@link TaskLocal#set(Object)}은 기존 context를 수정하지 않고
 * 새 context로 교체합니다. 따라서 캡처된 context는 이후의 변경에 영향을 받지 않습니다.</p>
 *
 * <p><strong>전파 예:</strong></p>
 * <pre>
 * TaskContext captured = TaskContext.capture();
 * executor.execute(captured.wrap(() -> {
 *     // captured values visible here
 * }));
 * </pre>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class TaskContext {

    private static final TaskContext EMPTY = new TaskContext(Collections.emptyMap());

    private static final ThreadLocal<TaskContext> CURRENT = ThreadLocal.withInitial(() -> EMPTY);

    private final Map<TaskLocal<?>, Object> values;

    private TaskContext(Map<TaskLocal<?>, Object> values) {
        this.values = values;
    }

    /**
     * @return 값이 없는 context
     */
    public static TaskContext empty() {
        return EMPTY;
    }

    /**
     * 현재 스레드의 context 캡처.
     *
     * @return 현재 context (불변)
     */
    public static TaskContext capture() {
        return CURRENT.get();
    }

    /**
     * Context 설치.
     *
     * @param context 설치할 context
     * @return 이전 context (복원용)
     */
    public static TaskContext install(TaskContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        TaskContext previous = CURRENT.get();
        CURRENT.set(context);
        return previous;
    }

    /**
     * 이전 context 복원.
     *
     * @param previous {@link #install(TaskContext)}가 반환한 context
     */
    public static void restore(TaskContext previous) {
        if (previous == null || previous == EMPTY) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }

    /**
     * 이 context를 설치한 상태로 작업 실행.
     */
    public <T> T call(Callable<T> task) throws Exception {
        TaskContext previous = install(this);
        try {
            return task.call();
        } finally {
            restore(previous);
        }
    }

    /**
     * 이 context를 설치한 상태로 작업 실행.
     */
    public void run(Runnable task) {
        TaskContext previous = install(this);
        try {
            task.run();
        } finally {
            restore(previous);
        }
    }

    /**
     * 실행 시점에 이 context를 설치하는 Runnable로 감쌈.
     */
    public Runnable wrap(Runnable task) {
        return () -> run(task);
    }

    /**
     * 실행 시점에 이 context를 설치하는 Callable로 감쌈.
     */
    public <T> Callable<T> wrap(Callable<T> task) {
        return () -> call(task);
    }

    <T> T get(TaskLocal<T> key) {
        return key.cast(values.get(key));
    }

    TaskContext with(TaskLocal<?> key, Object value) {
        Map<TaskLocal<?>, Object> copy = new IdentityHashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return copy.isEmpty() ? EMPTY : new TaskContext(Collections.unmodifiableMap(copy));
    }

    static TaskContext current() {
        return CURRENT.get();
    }

    static void replaceCurrent(TaskContext context) {
        CURRENT.set(context);
    }

    @Override
    public String toString() {
        return "TaskContext{" + values.size() + " values}";
    }
}
