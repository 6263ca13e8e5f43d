package com.ryuqq.enginebridge.core.loop;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 협력적 취소 토큰.
 *
 * <p>취소되면 등록된 listener를 등록 순서대로 한 번씩 실행합니다.
 * 취소 이후에 등록된 listener는 즉시 실행됩니다. 등록된 listener는 해제할 수 없습니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * 취소. 두 번째 호출부터는 무시됩니다.
     *
     * @return 이 호출로 취소되었으면 true
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            // remove() decides the single runner when onCancel races with cancel
            if (listeners.remove(listener)) {
                listener.run();
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 취소 listener 등록.
     *
     * @param listener 취소 시 실행할 작업
     */
    public void onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    /**
     * @throws LoopCancelledException 취소된 경우
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new LoopCancelledException();
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + cancelled.get() + '}';
    }
}
