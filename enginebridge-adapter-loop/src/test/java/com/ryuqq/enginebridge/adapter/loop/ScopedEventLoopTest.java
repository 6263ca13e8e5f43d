package com.ryuqq.enginebridge.adapter.loop;

import com.ryuqq.enginebridge.core.loop.EventLoops;
import com.ryuqq.enginebridge.core.loop.LoopCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScopedEventLoop 테스트.
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
@DisplayName("ScopedEventLoop 테스트")
class ScopedEventLoopTest {

    private TaskScope scope;

    @BeforeEach
    void setUp() {
        scope = TaskScope.open("scoped-test");
    }

    @AfterEach
    void tearDown() {
        EventLoops.set(EventLoops.NO_LOOP);
        scope.cancel();
        scope.close();
    }

    @Test
    @DisplayName("닫힌 scope에는 attach할 수 없고 NO_LOOP로 돌아간다")
    void 닫힌_scope_attach() {
        // given
        scope.close();
        ScopedEventLoop loop = new ScopedEventLoop(scope);

        // when & then
        assertThatThrownBy(() -> EventLoops.set(loop))
            .isInstanceOf(IllegalStateException.class);
        assertThat(EventLoops.get()).isSameAs(EventLoops.NO_LOOP);
        assertThat(loop.isAttached()).isFalse();
    }

    @Test
    @DisplayName("detach는 scope를 취소한다")
    void detach_scope_취소() {
        // given
        ScopedEventLoop loop = new ScopedEventLoop(scope);
        EventLoops.set(loop);

        // when
        EventLoops.set(EventLoops.NO_LOOP);

        // then
        assertThat(scope.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("scope가 취소되면 loop 작업의 nextCycle은 취소로 끝난다")
    void scope_취소_nextCycle() throws Exception {
        // given
        ScopedEventLoop loop = new ScopedEventLoop(scope);
        EventLoops.set(loop);

        // when
        CompletableFuture<Void> next = loop.fromThread(() -> {
            scope.cancel();
            return loop.nextCycle();
        }).get(5, TimeUnit.SECONDS);

        // then
        assertThatThrownBy(() -> next.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(LoopCancelledException.class);
    }

    @Test
    @DisplayName("toThread 동시 실행 수는 workerThreads로 제한된다")
    void toThread_동시성_제한() throws Exception {
        // given
        ScopedEventLoop loop = new ScopedEventLoop(scope, new LoopConfig().withWorkerThreads(1));
        EventLoops.set(loop);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CountDownLatch bothSubmitted = new CountDownLatch(1);

        // when
        CompletableFuture<Integer> first = loop.toThread(() -> work(running, maxRunning, bothSubmitted));
        CompletableFuture<Integer> second = loop.toThread(() -> work(running, maxRunning, bothSubmitted));
        bothSubmitted.countDown();

        // then
        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(1);
        assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo(1);
        assertThat(maxRunning.get()).isEqualTo(1);
        assertThat(loop.availableWorkerSlots()).isEqualTo(1);
    }

    private static int work(AtomicInteger running, AtomicInteger maxRunning, CountDownLatch gate) throws InterruptedException {
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        gate.await(5, TimeUnit.SECONDS);
        Thread.sleep(50);
        running.decrementAndGet();
        return 1;
    }

    @Test
    @DisplayName("닫힌 scope에서의 toThread는 실패한 future를 반환한다")
    void 닫힌_scope_toThread() {
        // given
        ScopedEventLoop loop = new ScopedEventLoop(scope);
        EventLoops.set(loop);
        scope.close();

        // when
        CompletableFuture<Integer> result = loop.toThread(() -> 1);

        // then
        assertThat(result).isCompletedExceptionally();
    }
}
