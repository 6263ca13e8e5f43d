package com.ryuqq.enginebridge.testkit.contract;

import com.ryuqq.enginebridge.core.exception.ConfigurationException;
import com.ryuqq.enginebridge.core.model.EnvironmentData;
import com.ryuqq.enginebridge.core.spi.Environment;
import com.ryuqq.enginebridge.core.spi.EnvironmentPolicy;
import com.ryuqq.enginebridge.core.spi.EnvironmentPolicyApi;
import com.ryuqq.enginebridge.core.spi.NativeCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Policy decorator that stays registered with a runtime for its whole lifetime.
 *
 * <p>A native runtime accepts exactly one policy registration. Tests need a fresh policy per
 * test case, so the proxy is registered once and each test {@link #attach(EnvironmentPolicy) attaches}
 * its own policy behind it. Unregistering the attached policy only detaches it from the proxy.</p>
 *
 * <p>While nothing is attached, every policy query fails with {@link ConfigurationException}.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class ProxyPolicy implements EnvironmentPolicy {

    private static final Logger log = LoggerFactory.getLogger(ProxyPolicy.class);

    private volatile EnvironmentPolicyApi runtimeApi;
    private volatile EnvironmentPolicy target;

    @Override
    public void onPolicyRegistered(EnvironmentPolicyApi api) {
        if (api == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        this.runtimeApi = api;
    }

    @Override
    public void onPolicyCleared() {
        forcefullyUnregisterPolicy();
        this.runtimeApi = null;
    }

    /**
     * Attaches a policy behind this proxy.
     *
     * @param policy the policy to attach
     * @throws IllegalStateException if the proxy is not registered or another policy is attached
     */
    public synchronized void attach(EnvironmentPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        EnvironmentPolicyApi api = runtimeApi;
        if (api == null) {
            throw new IllegalStateException("This proxy is not registered with a runtime.");
        }
        if (target != null) {
            throw new IllegalStateException("Another policy is already attached: " + target);
        }

        target = policy;
        try {
            policy.onPolicyRegistered(new DetachingApi(api, policy));
        } catch (RuntimeException e) {
            target = null;
            throw e;
        }
        log.debug("Attached {}", policy);
    }

    /**
     * Detaches whatever policy is currently attached.
     *
     * <p>Used by test teardown so that a test that forgot to unregister its policy
     * does not leak into the next one.</p>
     */
    public synchronized void forcefullyUnregisterPolicy() {
        EnvironmentPolicy attached = target;
        if (attached == null) {
            return;
        }
        log.warn("Forcefully unregistering {}", attached);
        detach(attached);
    }

    /**
     * @return true if a policy is attached
     */
    public boolean isAttached() {
        return target != null;
    }

    /**
     * @return the attached policy, or null
     */
    public EnvironmentPolicy attached() {
        return target;
    }

    private synchronized void detach(EnvironmentPolicy policy) {
        if (target != policy) {
            throw new IllegalStateException("Policy is not attached to this proxy: " + policy);
        }
        target = null;
        policy.onPolicyCleared();
        log.debug("Detached {}", policy);
    }

    private EnvironmentPolicy requireTarget() {
        EnvironmentPolicy attached = target;
        if (attached == null) {
            throw new ConfigurationException("This proxy is not attached to a policy.");
        }
        return attached;
    }

    @Override
    public EnvironmentData getCurrentEnvironment() {
        return requireTarget().getCurrentEnvironment();
    }

    @Override
    public void setEnvironment(EnvironmentData environment) {
        requireTarget().setEnvironment(environment);
    }

    @Override
    public boolean isAlive(EnvironmentData environment) {
        return requireTarget().isAlive(environment);
    }

    @Override
    public String toString() {
        return "ProxyPolicy{attached=" + target + "}";
    }

    /**
     * Runtime API handed to the attached policy; unregistering detaches instead of
     * unregistering the proxy itself.
     */
    private final class DetachingApi implements EnvironmentPolicyApi {

        private final EnvironmentPolicyApi delegate;
        private final EnvironmentPolicy owner;

        private DetachingApi(EnvironmentPolicyApi delegate, EnvironmentPolicy owner) {
            this.delegate = delegate;
            this.owner = owner;
        }

        @Override
        public EnvironmentData createEnvironment() {
            return delegate.createEnvironment();
        }

        @Override
        public Environment wrapEnvironment(EnvironmentData data) {
            return delegate.wrapEnvironment(data);
        }

        @Override
        public void destroyEnvironment(EnvironmentData data) {
            delegate.destroyEnvironment(data);
        }

        @Override
        public boolean isAlive(EnvironmentData data) {
            return delegate.isAlive(data);
        }

        @Override
        public NativeCore coreOf(EnvironmentData data) {
            return delegate.coreOf(data);
        }

        @Override
        public void unregisterPolicy() {
            detach(owner);
        }
    }
}
