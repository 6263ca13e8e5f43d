package com.ryuqq.enginebridge.testkit.contract;

import com.ryuqq.enginebridge.adapter.inmemory.runtime.InMemoryNativeRuntime;
import com.ryuqq.enginebridge.application.policy.ManagedEnvironment;
import com.ryuqq.enginebridge.application.policy.Policy;
import com.ryuqq.enginebridge.core.hospice.Hospice;
import com.ryuqq.enginebridge.core.loop.EventLoop;
import com.ryuqq.enginebridge.core.loop.EventLoops;
import com.ryuqq.enginebridge.core.model.EnvironmentData;
import com.ryuqq.enginebridge.core.spi.Environment;
import com.ryuqq.enginebridge.core.store.StoreStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for bridge contract tests.
 *
 * <p>Each test gets a fresh runtime, hospice and policy. The policy is attached through a
 * {@link ProxyPolicy} so that the runtime registration outlives the test.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryNativeRuntime behind a ProxyRuntime</li>
 *   <li>Hospice driven by a ManualReachabilityObserver</li>
 *   <li>The event loop returned by {@link #eventLoop()}</li>
 * </ul>
 *
 * <p><strong>Teardown:</strong> the loop is reset to {@link EventLoops#NO_LOOP}, environments created
 * through {@link #newEnvironment()} are disposed, the policy is unregistered (forcefully if needed),
 * and the hospice must be empty after the remaining cores are drained.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * public class MyContractTest extends AbstractBridgeTest {
 *     {@literal @}Test
 *     void testScenario() throws Exception {
 *         ManagedEnvironment environment = newEnvironment();
 *         try (EnvironmentScope ignored = environment.use()) {
 *             assertCurrentEnvironment(environment);
 *         }
 *     }
 * }
 * </pre>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public abstract class AbstractBridgeTest {

    /**
     * Number of collector notifications a dead environment's core needs before release.
     */
    protected static final int RELEASE_CYCLES = 3;

    protected InMemoryNativeRuntime runtime;
    protected ProxyRuntime proxyRuntime;
    protected ManualReachabilityObserver observer;
    protected Hospice hospice;
    protected Policy policy;

    private final List<ManagedEnvironment> environments = new ArrayList<>();

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUpBridge() {
        runtime = new InMemoryNativeRuntime(workerCount());
        proxyRuntime = new ProxyRuntime(runtime);
        observer = new ManualReachabilityObserver();
        hospice = new Hospice(observer);
        policy = new Policy(proxyRuntime, storeStrategy().newStore(), hospice);
        policy.register();
        EventLoops.set(eventLoop());
    }

    /**
     * Cleans up and checks that nothing was left behind.
     */
    @AfterEach
    void tearDownBridge() {
        EventLoops.set(EventLoops.NO_LOOP);

        if (policy.managed().isRegistered()) {
            for (ManagedEnvironment environment : environments) {
                environment.dispose();
            }
        }
        environments.clear();

        policy.close();
        proxyRuntime.proxy().forcefullyUnregisterPolicy();

        observer.collectAll();
        runCycles(RELEASE_CYCLES);
        assertFalse(hospice.anyAlive(), "Hospice still holds cores after teardown");
    }

    /**
     * Event loop installed for the test. Defaults to {@link EventLoops#NO_LOOP}.
     */
    protected EventLoop eventLoop() {
        return EventLoops.NO_LOOP;
    }

    /**
     * Store strategy of the test policy. Defaults to {@link StoreStrategy#THREAD_LOCAL}.
     */
    protected StoreStrategy storeStrategy() {
        return StoreStrategy.THREAD_LOCAL;
    }

    /**
     * Worker count of every core created by the runtime.
     */
    protected int workerCount() {
        return 2;
    }

    /**
     * Creates an environment that is disposed on teardown.
     *
     * @return a new environment
     */
    protected ManagedEnvironment newEnvironment() {
        ManagedEnvironment environment = policy.newEnvironment();
        environments.add(environment);
        return environment;
    }

    /**
     * Sends the given number of collector notifications to the hospice.
     */
    protected void runCycles(int cycles) {
        for (int i = 0; i < cycles; i++) {
            hospice.collectorCycleCompleted();
        }
    }

    /**
     * @return data of the environment the runtime currently sees, if any
     */
    protected Optional<EnvironmentData> currentData() {
        return runtime.currentEnvironment().map(Environment::data);
    }

    protected void assertCurrentEnvironment(ManagedEnvironment expected) {
        Optional<EnvironmentData> current = currentData();
        assertTrue(current.isPresent(), "No current environment");
        assertSame(expected.data(), current.get());
    }

    protected void assertNoCurrentEnvironment() {
        assertFalse(currentData().isPresent(), "Unexpected current environment: " + currentData());
    }
}
