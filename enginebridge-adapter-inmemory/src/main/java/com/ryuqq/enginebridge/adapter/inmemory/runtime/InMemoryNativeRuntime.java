package com.ryuqq.enginebridge.adapter.inmemory.runtime;

import com.ryuqq.enginebridge.core.exception.ConfigurationException;
import com.ryuqq.enginebridge.core.exception.DeadEnvironmentException;
import com.ryuqq.enginebridge.core.model.EnvironmentData;
import com.ryuqq.enginebridge.core.spi.Environment;
import com.ryuqq.enginebridge.core.spi.EnvironmentPolicy;
import com.ryuqq.enginebridge.core.spi.NativeRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link NativeRuntime} for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>policy:</strong> the single registration slot</li>
 *   <li><strong>cores:</strong> ConcurrentHashMap&lt;EnvironmentData, InMemoryCore&gt; - live environments
 *       and the core each one owns</li>
 * </ul>
 *
 * <p><strong>Registration:</strong></p>
 * <ul>
 *   <li>A second {@link #registerPolicy(EnvironmentPolicy)} while one is registered fails</li>
 *   <li>If the policy rejects {@code onPolicyRegistered}, the slot is released again</li>
 *   <li>{@link InMemoryPolicyApi#unregisterPolicy()} empties the slot and calls {@code onPolicyCleared}</li>
 * </ul>
 *
 * <p><strong>Environment lookup:</strong> the runtime never tracks the active environment itself.
 * {@link #currentEnvironment()} always asks the registered policy.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryNativeRuntime runtime = new InMemoryNativeRuntime(2);
 * Policy policy = new Policy(runtime, StoreStrategy.THREAD_LOCAL.newStore());
 * policy.register();
 * try (ManagedEnvironment environment = policy.newEnvironment();
 *      EnvironmentScope scope = environment.use()) {
 *     runtime.currentEnvironment(); // → environment
 * }
 * </pre>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public class InMemoryNativeRuntime implements NativeRuntime {

    private static final Logger log = LoggerFactory.getLogger(InMemoryNativeRuntime.class);

    private static final AtomicLong CORE_IDS = new AtomicLong();

    private final int workerCount;
    private final Object registrationLock = new Object();
    private final ConcurrentHashMap<EnvironmentData, InMemoryCore> cores = new ConcurrentHashMap<>();
    private final AtomicInteger createdEnvironments = new AtomicInteger();

    private EnvironmentPolicy policy;

    /**
     * 기본 생성자 (worker 수 = 사용 가능한 프로세서 수).
     */
    public InMemoryNativeRuntime() {
        this(Runtime.getRuntime().availableProcessors());
    }

    /**
     * 생성자.
     *
     * @param workerCount 각 core의 worker 수 (1 이상)
     * @throws IllegalArgumentException workerCount가 1 미만인 경우
     */
    public InMemoryNativeRuntime(int workerCount) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException(
                "workerCount must be positive (current: " + workerCount + ")"
            );
        }
        this.workerCount = workerCount;
    }

    @Override
    public void registerPolicy(EnvironmentPolicy newPolicy) {
        if (newPolicy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }

        synchronized (registrationLock) {
            if (policy != null) {
                throw new IllegalStateException("An environment policy is already registered: " + policy);
            }
            policy = newPolicy;
        }

        try {
            newPolicy.onPolicyRegistered(new InMemoryPolicyApi(this, newPolicy));
        } catch (RuntimeException e) {
            synchronized (registrationLock) {
                if (policy == newPolicy) {
                    policy = null;
                }
            }
            throw e;
        }
        log.info("Registered environment policy {}", newPolicy);
    }

    /**
     * 등록 해제 (InMemoryPolicyApi에서 호출).
     *
     * @throws IllegalStateException 해당 policy가 등록되어 있지 않은 경우
     */
    void unregisterPolicy(EnvironmentPolicy registered) {
        synchronized (registrationLock) {
            if (policy != registered) {
                throw new IllegalStateException("Policy is not registered: " + registered);
            }
            policy = null;
        }
        try {
            registered.onPolicyCleared();
        } finally {
            log.info("Unregistered environment policy {}", registered);
        }
    }

    @Override
    public Optional<Environment> currentEnvironment() {
        EnvironmentPolicy registered = registeredPolicy();
        if (registered == null) {
            throw new ConfigurationException("No environment policy is registered");
        }
        EnvironmentData data = registered.getCurrentEnvironment();
        if (data == null) {
            return Optional.empty();
        }
        return Optional.of(new InMemoryEnvironment(data, this));
    }

    @Override
    public int availableWorkers() {
        return workerCount;
    }

    /**
     * @return 현재 등록된 policy (없으면 null)
     */
    public EnvironmentPolicy registeredPolicy() {
        synchronized (registrationLock) {
            return policy;
        }
    }

    /**
     * @return 아직 destroy되지 않은 environment 수
     */
    public int liveEnvironmentCount() {
        return cores.size();
    }

    /**
     * @return 지금까지 생성된 environment 수
     */
    public int createdEnvironmentCount() {
        return createdEnvironments.get();
    }

    EnvironmentData createEnvironment() {
        EnvironmentData data = EnvironmentData.allocate();
        InMemoryCore core = new InMemoryCore(CORE_IDS.incrementAndGet(), workerCount);
        cores.put(data, core);
        createdEnvironments.incrementAndGet();
        log.debug("Created environment {} with core {}", data, core.id());
        return data;
    }

    void destroyEnvironment(EnvironmentData data) {
        if (cores.remove(data) == null) {
            throw new DeadEnvironmentException(data);
        }
        log.debug("Destroyed environment {}", data);
    }

    boolean isAlive(EnvironmentData data) {
        return data != null && cores.containsKey(data);
    }

    InMemoryCore coreOf(EnvironmentData data) {
        InMemoryCore core = cores.get(data);
        if (core == null) {
            throw new DeadEnvironmentException(data);
        }
        return core;
    }

    @Override
    public String toString() {
        return "InMemoryNativeRuntime{workers=" + workerCount + ", live=" + cores.size() + "}";
    }
}
