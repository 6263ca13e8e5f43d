package com.ryuqq.enginebridge.testkit.contract;

import com.ryuqq.enginebridge.core.spi.Environment;
import com.ryuqq.enginebridge.core.spi.EnvironmentPolicy;
import com.ryuqq.enginebridge.core.spi.NativeRuntime;

import java.util.Optional;

/**
 * Runtime view that routes policy registration through a {@link ProxyPolicy}.
 *
 * <p>The proxy is registered with the delegate runtime on construction and stays registered;
 * {@link #registerPolicy(EnvironmentPolicy)} attaches the given policy to the proxy.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class ProxyRuntime implements NativeRuntime {

    private final NativeRuntime delegate;
    private final ProxyPolicy proxy;

    /**
     * Creates the view and registers a new proxy with the delegate.
     *
     * @param delegate the runtime that owns environments and cores
     */
    public ProxyRuntime(NativeRuntime delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
        this.proxy = new ProxyPolicy();
        delegate.registerPolicy(proxy);
    }

    @Override
    public void registerPolicy(EnvironmentPolicy policy) {
        proxy.attach(policy);
    }

    @Override
    public Optional<Environment> currentEnvironment() {
        return delegate.currentEnvironment();
    }

    @Override
    public int availableWorkers() {
        return delegate.availableWorkers();
    }

    public ProxyPolicy proxy() {
        return proxy;
    }

    public NativeRuntime delegate() {
        return delegate;
    }
}
