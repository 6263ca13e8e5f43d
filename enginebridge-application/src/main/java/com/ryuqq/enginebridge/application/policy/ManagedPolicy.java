package com.ryuqq.enginebridge.application.policy;

import com.ryuqq.enginebridge.core.exception.ConfigurationException;
import com.ryuqq.enginebridge.core.model.EnvironmentData;
import com.ryuqq.enginebridge.core.spi.EnvironmentPolicy;
import com.ryuqq.enginebridge.core.spi.EnvironmentPolicyApi;
import com.ryuqq.enginebridge.core.store.EnvironmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Store 하나에 현재 environment를 보관하는 policy.
 *
 * <p><strong>조회 규칙:</strong></p>
 * <ol>
 *   <li>현재 스레드가 inline section 안이고 그 environment가 살아있으면 그것을 반환</li>
 *   <li>store의 weak reference가 비었거나 runtime이 죽었다고 보고하면 store를 비우고 경고 후 null</li>
 *   <li>그 외에는 store의 environment 반환</li>
 * </ol>
 *
 * <p>store 조회와 생존 확인은 하나의 lock 안에서 수행되어 check-then-use가 원자적입니다.</p>
 *
 * <p><strong>등록 상태:</strong> {@link #onPolicyRegistered(EnvironmentPolicyApi)}와
 * {@link #onPolicyCleared()} 사이에서만 {@link #api()}를 사용할 수 있습니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public class ManagedPolicy implements EnvironmentPolicy {

    private static final Logger log = LoggerFactory.getLogger(ManagedPolicy.class);

    private final EnvironmentStore store;
    private final ReentrantLock mutex = new ReentrantLock();
    private final ThreadLocal<EnvironmentData> inlineEnvironment = new ThreadLocal<>();

    private volatile EnvironmentPolicyApi api;

    /**
     * 생성자.
     *
     * @param store 현재 environment 저장소
     * @throws IllegalArgumentException store가 null인 경우
     */
    public ManagedPolicy(EnvironmentStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public void onPolicyRegistered(EnvironmentPolicyApi registeredApi) {
        if (registeredApi == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        this.api = registeredApi;
        log.debug("Successfully registered policy with the native runtime");
    }

    @Override
    public void onPolicyCleared() {
        this.api = null;
        log.debug("Policy cleared");
    }

    /**
     * @return runtime API
     * @throws ConfigurationException 등록되지 않은 경우
     */
    public EnvironmentPolicyApi api() {
        EnvironmentPolicyApi current = api;
        if (current == null) {
            throw new ConfigurationException("Invalid state: policy is not registered with the native runtime");
        }
        return current;
    }

    public boolean isRegistered() {
        return api != null;
    }

    @Override
    public EnvironmentData getCurrentEnvironment() {
        EnvironmentData inline = inlineEnvironment.get();
        if (inline != null && isAlive(inline)) {
            return inline;
        }

        mutex.lock();
        try {
            WeakReference<EnvironmentData> reference = store.getCurrentEnvironment();
            if (reference == null) {
                return null;
            }

            EnvironmentData received = reference.get();
            if (received == null || !isAlive(received)) {
                log.warn("Got dead environment: {}", received);
                store.setCurrentEnvironment(null);
                return null;
            }
            return received;
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public void setEnvironment(EnvironmentData environment) {
        mutex.lock();
        try {
            if (environment == null) {
                store.setCurrentEnvironment(null);
                return;
            }
            if (!isAlive(environment)) {
                log.warn("Got dead environment: {}", environment);
                store.setCurrentEnvironment(null);
                return;
            }
            log.debug("Setting environment: {}", environment);
            store.setCurrentEnvironment(new WeakReference<>(environment));
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public boolean isAlive(EnvironmentData environment) {
        EnvironmentPolicyApi current = api;
        return current != null && environment != null && current.isAlive(environment);
    }

    /**
     * 현재 스레드에서만 environment 전환 (store는 건드리지 않음).
     *
     * <p>section 안에서는 스레드를 넘기거나 loop에 제어를 돌려주면 안 됩니다.</p>
     *
     * @param environment section 동안 사용할 environment
     * @return 직전 inline environment ({@link #inlineSectionEnd(EnvironmentData)}에 전달)
     */
    public EnvironmentData inlineSectionStart(EnvironmentData environment) {
        EnvironmentData previous = inlineEnvironment.get();
        inlineEnvironment.set(environment);
        return previous;
    }

    /**
     * inline section 종료.
     *
     * @param previous {@link #inlineSectionStart(EnvironmentData)}가 반환한 값
     */
    public void inlineSectionEnd(EnvironmentData previous) {
        if (previous == null) {
            inlineEnvironment.remove();
        } else {
            inlineEnvironment.set(previous);
        }
    }

    public EnvironmentStore store() {
        return store;
    }

    @Override
    public String toString() {
        return "ManagedPolicy{store=" + store.getClass().getSimpleName() + ", registered=" + isRegistered() + "}";
    }
}
