package com.ryuqq.enginebridge.core.hospice;

import java.lang.ref.Cleaner;

/**
 * {@link Cleaner} 기반 관찰자.
 *
 * <p>콜백은 Cleaner 스레드에서 실행됩니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class CleanerReachabilityObserver implements ReachabilityObserver {

    private final Cleaner cleaner;

    public CleanerReachabilityObserver() {
        this(Cleaner.create());
    }

    public CleanerReachabilityObserver(Cleaner cleaner) {
        if (cleaner == null) {
            throw new IllegalArgumentException("cleaner cannot be null");
        }
        this.cleaner = cleaner;
    }

    @Override
    public void watch(Object referent, Runnable onUnreachable) {
        if (referent == null) {
            throw new IllegalArgumentException("referent cannot be null");
        }
        if (onUnreachable == null) {
            throw new IllegalArgumentException("onUnreachable cannot be null");
        }
        cleaner.register(referent, onUnreachable);
    }
}
