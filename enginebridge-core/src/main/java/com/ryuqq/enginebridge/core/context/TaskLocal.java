package com.ryuqq.enginebridge.core.context;

/**
 * {@link TaskContext}에 저장되는 값의 키.
 *
 * <p>인스턴스 identity가 곧 키입니다. 서로 다른 TaskLocal은 값을 공유하지 않습니다.</p>
 *
 * @param <T> 값 타입
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class TaskLocal<T> {

    private final String name;
    private final Class<T> type;

    /**
     * @param name 진단용 이름
     * @param type 값 타입
     */
    public TaskLocal(String name, Class<T> type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.name = name;
        this.type = type;
    }

    /**
     * @return 현재 task의 값 (없으면 null)
     */
    public T get() {
        return TaskContext.current().get(this);
    }

    /**
     * 현재 task의 값 변경.
     *
     * <p>이미 캡처된 context(부모, 형제 task)에는 보이지 않습니다.</p>
     *
     * @param value 새 값 (null이면 제거)
     */
    public void set(T value) {
        TaskContext.replaceCurrent(TaskContext.current().with(this, value));
    }

    T cast(Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return "TaskLocal{" + name + '}';
    }
}
