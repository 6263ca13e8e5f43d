package com.ryuqq.enginebridge.testkit.contract;

import com.ryuqq.enginebridge.application.pipeline.PrefetchBuffer;
import com.ryuqq.enginebridge.application.policy.ManagedEnvironment;
import com.ryuqq.enginebridge.core.future.UnifiedFuture;
import com.ryuqq.enginebridge.core.future.UnifiedIterator;
import com.ryuqq.enginebridge.core.loop.EventLoops;
import com.ryuqq.enginebridge.core.model.EnvironmentData;
import com.ryuqq.enginebridge.core.spi.EnvironmentScope;
import com.ryuqq.enginebridge.core.spi.NativeCore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: behaviour every event loop must share.
 *
 * <p>Subclasses pick the loop through {@link #eventLoop()}; the scenarios are identical.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>fromThread / toThread run with the caller's environment</li>
 *   <li>Loop callbacks run with the registering environment, whichever thread completes the future</li>
 *   <li>Unified futures chain across the loop</li>
 *   <li>Prefetched core requests are consumed in request order</li>
 * </ul>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
abstract class AbstractLoopContractTest extends AbstractBridgeTest {

    private static final long TIMEOUT_SECONDS = 5;

    @Test
    void testFromThread_RunsWithCallerEnvironment() throws Exception {
        // Given
        ManagedEnvironment environment = newEnvironment();

        try (EnvironmentScope ignored = environment.use()) {
            // When
            Optional<EnvironmentData> seen = EventLoops.fromThread(this::currentData)
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

            // Then
            assertEquals(Optional.of(environment.data()), seen);
        }
    }

    @Test
    void testLoopFromThread_RunsWithCallerEnvironment() throws Exception {
        // Given
        ManagedEnvironment environment = newEnvironment();

        try (EnvironmentScope ignored = environment.use()) {
            // When
            Optional<EnvironmentData> seen = EventLoops.get().fromThread(this::currentData)
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

            // Then
            assertEquals(Optional.of(environment.data()), seen);
        }
    }

    @Test
    void testLoopToThread_RunsWithCallerEnvironment() throws Exception {
        // Given
        ManagedEnvironment environment = newEnvironment();

        try (EnvironmentScope ignored = environment.use()) {
            // When
            Optional<EnvironmentData> seen = EventLoops.get().toThread(this::currentData)
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

            // Then
            assertEquals(Optional.of(environment.data()), seen);
        }
    }

    /**
     * A native worker completes the future after the registering scope has closed.
     */
    @Test
    void testLoopCallback_CompletedFromForeignThread_RunsWithRegistrationEnvironment() throws Exception {
        // Given
        ManagedEnvironment environment = newEnvironment();
        CompletableFuture<Integer> source = new CompletableFuture<>();
        CompletableFuture<Optional<EnvironmentData>> seen = new CompletableFuture<>();

        try (EnvironmentScope ignored = environment.use()) {
            UnifiedFuture.fromFuture(source).addLoopCallback(future -> seen.complete(currentData()));
        }
        assertNoCurrentEnvironment();

        // When
        Thread nativeWorker = new Thread(() -> source.complete(7), "native-worker");
        nativeWorker.start();
        nativeWorker.join(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));

        // Then
        assertEquals(Optional.of(environment.data()), seen.get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
    }

    @Test
    void testToThread_RunsWithCallerEnvironment() throws Exception {
        // Given
        ManagedEnvironment environment = newEnvironment();

        try (EnvironmentScope ignored = environment.use()) {
            // When
            Optional<EnvironmentData> seen = EventLoops.toThread(this::currentData)
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

            // Then
            assertEquals(Optional.of(environment.data()), seen);
        }
        assertNoCurrentEnvironment();
    }

    @Test
    void testToThread_WithoutEnvironment_RunsWithNone() throws Exception {
        // When
        Optional<EnvironmentData> seen = EventLoops.toThread(this::currentData)
                .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // Then
        assertEquals(Optional.empty(), seen);
    }

    @Test
    void testUnifiedFuture_ChainsAcrossLoop() throws Exception {
        // Given
        UnifiedFuture<Integer> source = UnifiedFuture.fromFuture(EventLoops.toThread(() -> 21));

        // When
        Integer doubled = source.map(value -> value * 2).result(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // Then
        assertEquals(42, doubled);
    }

    @Test
    void testPrefetchedRequests_ConsumedInRequestOrder() throws Exception {
        // Given
        ManagedEnvironment environment = newEnvironment();
        NativeCore core = environment.core();
        Iterator<CompletableFuture<Integer>> requests = new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < 20;
            }

            @Override
            public CompletableFuture<Integer> next() {
                int frame = next++;
                return core.request(() -> {
                    Thread.sleep((20 - frame) % 4);
                    return frame;
                });
            }
        };
        List<Integer> consumed = Collections.synchronizedList(new ArrayList<>());

        // When
        try (PrefetchBuffer<Integer> buffer = PrefetchBuffer.buffer(requests, core)) {
            new UnifiedIterator<>(buffer)
                    .runAsCompleted(future -> consumed.add(future.result()))
                    .result(TIMEOUT_SECONDS, TimeUnit.SECONDS);

            // Then
            assertTrue(buffer.peakRunning() <= core.workerCount());
        }
        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            expected.add(i);
        }
        assertEquals(expected, consumed);
    }

    @Test
    void testRunAsCompleted_StopsWhenCallbackReturnsFalse() throws Exception {
        // Given
        List<CompletableFuture<Integer>> futures = List.of(
                CompletableFuture.completedFuture(1),
                CompletableFuture.completedFuture(2),
                CompletableFuture.completedFuture(3));
        List<Integer> consumed = Collections.synchronizedList(new ArrayList<>());

        // When
        new UnifiedIterator<>(futures.iterator())
                .runAsCompleted(future -> {
                    consumed.add(future.result());
                    return consumed.size() < 2;
                })
                .result(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        // Then
        assertEquals(List.of(1, 2), consumed);
    }
}
