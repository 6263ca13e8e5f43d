package com.ryuqq.enginebridge.testkit.contract;

import com.ryuqq.enginebridge.core.hospice.ReachabilityObserver;

import java.util.ArrayList;
import java.util.List;

/**
 * Reachability observer driven by the test instead of the garbage collector.
 *
 * <p>Watched referents are considered unreachable when {@link #collectAll()} is called.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class ManualReachabilityObserver implements ReachabilityObserver {

    private final List<Runnable> pending = new ArrayList<>();

    @Override
    public synchronized void watch(Object referent, Runnable onUnreachable) {
        if (referent == null) {
            throw new IllegalArgumentException("referent cannot be null");
        }
        if (onUnreachable == null) {
            throw new IllegalArgumentException("onUnreachable cannot be null");
        }
        pending.add(onUnreachable);
    }

    /**
     * Fires every pending notification, in admission order.
     */
    public void collectAll() {
        List<Runnable> fired;
        synchronized (this) {
            fired = new ArrayList<>(pending);
            pending.clear();
        }
        fired.forEach(Runnable::run);
    }

    /**
     * @return number of referents not yet reported unreachable
     */
    public synchronized int pendingCount() {
        return pending.size();
    }
}
