package com.ryuqq.enginebridge.application.policy;

import com.ryuqq.enginebridge.core.exception.ConfigurationException;
import com.ryuqq.enginebridge.core.hospice.Hospice;
import com.ryuqq.enginebridge.core.loop.EventLoops;
import com.ryuqq.enginebridge.core.model.EnvironmentData;
import com.ryuqq.enginebridge.core.spi.Environment;
import com.ryuqq.enginebridge.core.spi.EnvironmentPolicyApi;
import com.ryuqq.enginebridge.core.spi.NativeRuntime;
import com.ryuqq.enginebridge.core.store.EnvironmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ManagedPolicy}의 등록과 environment 생성을 담당하는 진입점.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>register(): runtime의 단일 등록 슬롯에 ManagedPolicy 등록, loop용 environment propagator 설치</li>
 *   <li>unregister(): propagator 제거, 등록 해제</li>
 *   <li>newEnvironment(): 새 environment와 core 생성</li>
 * </ul>
 *
 * <p>try-with-resources로 사용하면 블록을 벗어날 때 등록이 해제됩니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public class Policy implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Policy.class);

    private final NativeRuntime runtime;
    private final ManagedPolicy managed;
    private final Hospice hospice;
    private final EnvironmentPropagator propagator;

    /**
     * 생성자 (공용 hospice 사용).
     *
     * @param runtime native runtime
     * @param store 현재 environment 저장소
     */
    public Policy(NativeRuntime runtime, EnvironmentStore store) {
        this(runtime, store, Hospice.shared());
    }

    /**
     * 생성자.
     *
     * @param runtime native runtime
     * @param store 현재 environment 저장소
     * @param hospice dispose된 core를 넘길 hospice
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Policy(NativeRuntime runtime, EnvironmentStore store, Hospice hospice) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (hospice == null) {
            throw new IllegalArgumentException("hospice cannot be null");
        }
        this.runtime = runtime;
        this.managed = new ManagedPolicy(store);
        this.hospice = hospice;
        this.propagator = new EnvironmentPropagator(managed);
    }

    /**
     * Runtime에 등록.
     *
     * @throws IllegalStateException 다른 policy가 이미 등록된 경우
     */
    public void register() {
        runtime.registerPolicy(managed);
        EventLoops.installPropagator(propagator);
        log.info("Registered {}", managed);
    }

    /**
     * 등록 해제.
     *
     * @throws ConfigurationException 등록되지 않은 경우
     */
    public void unregister() {
        EnvironmentPolicyApi api = api();
        EventLoops.uninstallPropagator(propagator);
        api.unregisterPolicy();
        log.info("Unregistered {}", managed);
    }

    /**
     * 등록되어 있으면 해제.
     */
    @Override
    public void close() {
        if (managed.isRegistered()) {
            unregister();
        }
    }

    /**
     * 새 environment 생성.
     *
     * <p>사용 후에는 반드시 {@link ManagedEnvironment#dispose()}를 호출해야 합니다.</p>
     *
     * @throws ConfigurationException 등록되지 않은 경우
     */
    public ManagedEnvironment newEnvironment() {
        EnvironmentPolicyApi api = api();
        EnvironmentData data = api.createEnvironment();
        Environment environment = api.wrapEnvironment(data);
        log.debug("Created new environment {}", data);
        return new ManagedEnvironment(environment, data, this);
    }

    /**
     * @throws ConfigurationException 등록되지 않은 경우
     */
    public EnvironmentPolicyApi api() {
        return managed.api();
    }

    public ManagedPolicy managed() {
        return managed;
    }

    public Hospice hospice() {
        return hospice;
    }

    public NativeRuntime runtime() {
        return runtime;
    }
}
