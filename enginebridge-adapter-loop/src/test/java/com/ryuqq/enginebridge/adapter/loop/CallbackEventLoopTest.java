package com.ryuqq.enginebridge.adapter.loop;

import com.ryuqq.enginebridge.core.future.UnifiedFuture;
import com.ryuqq.enginebridge.core.future.UnifiedIterator;
import com.ryuqq.enginebridge.core.loop.EventLoops;
import com.ryuqq.enginebridge.core.loop.LoopCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CallbackEventLoop 테스트.
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
@DisplayName("CallbackEventLoop 테스트")
class CallbackEventLoopTest {

    private static final String LOOP_THREAD = "test-callback-loop";

    private CallbackEventLoop loop;

    @BeforeEach
    void setUp() {
        loop = new CallbackEventLoop(new LoopConfig().withThreadName(LOOP_THREAD).withWorkerThreads(2));
        EventLoops.set(loop);
    }

    @AfterEach
    void tearDown() {
        EventLoops.set(EventLoops.NO_LOOP);
    }

    // ============================================================
    // 1. loop 스레드 실행
    // ============================================================

    @Test
    @DisplayName("fromThread 작업은 loop 스레드에서 실행된다")
    void fromThread_loop_스레드() throws Exception {
        // when
        String thread = loop.fromThread(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

        // then
        assertThat(thread).isEqualTo(LOOP_THREAD);
        assertThat(loop.isLoopThread()).isFalse();
    }

    @Test
    @DisplayName("addLoopCallback은 완료한 스레드와 상관없이 loop 스레드에서 실행된다")
    void loop_callback_스레드() throws Exception {
        // given
        CompletableFuture<Integer> source = new CompletableFuture<>();
        UnifiedFuture<Integer> future = UnifiedFuture.fromFuture(source);
        CompletableFuture<String> observed = new CompletableFuture<>();
        future.addLoopCallback(f -> observed.complete(Thread.currentThread().getName() + ":" + f.result()));

        // when
        Thread completer = new Thread(() -> source.complete(42), "completer");
        completer.start();

        // then
        assertThat(observed.get(5, TimeUnit.SECONDS)).isEqualTo(LOOP_THREAD + ":42");
    }

    @Test
    @DisplayName("toThread 작업은 worker 스레드에서 실행되고 결과는 loop 스레드로 전달된다")
    void toThread_결과_전달() throws Exception {
        // given
        AtomicReference<String> worker = new AtomicReference<>();
        AtomicReference<String> delivery = new AtomicReference<>();

        // when
        Integer result = loop.toThread(() -> {
                worker.set(Thread.currentThread().getName());
                return 7;
            })
            .thenApply(value -> {
                delivery.set(Thread.currentThread().getName());
                return value;
            })
            .get(5, TimeUnit.SECONDS);

        // then
        assertThat(result).isEqualTo(7);
        assertThat(worker.get()).startsWith(LOOP_THREAD + "-worker-");
        assertThat(delivery.get()).isEqualTo(LOOP_THREAD);
    }

    @Test
    @DisplayName("awaitFuture는 원본의 실패를 loop 스레드에서 전달한다")
    void awaitFuture_실패_전달() {
        // given
        CompletableFuture<Object> source = new CompletableFuture<>();
        CompletableFuture<Object> awaited = loop.awaitFuture(source);

        // when
        source.completeExceptionally(new IllegalStateException("render failed"));

        // then
        assertThatThrownBy(() -> awaited.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    // ============================================================
    // 2. 취소
    // ============================================================

    @Test
    @DisplayName("취소된 작업의 nextCycle은 LoopCancelledException으로 실패한다")
    void nextCycle_취소() throws Exception {
        // when
        CompletableFuture<Void> next = loop.fromThread(() -> {
            loop.currentToken().cancel();
            return loop.nextCycle();
        }).get(5, TimeUnit.SECONDS);

        // then
        assertThatThrownBy(() -> next.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(LoopCancelledException.class);
    }

    @Test
    @DisplayName("취소되지 않은 작업의 nextCycle은 다음 loop 차례에 완료된다")
    void nextCycle_정상() throws Exception {
        // given
        List<String> order = new CopyOnWriteArrayList<>();

        // when
        CompletableFuture<Void> next = loop.fromThread(() -> {
            CompletableFuture<Void> cycle = loop.nextCycle();
            cycle.thenRun(() -> order.add("continuation"));
            loop.fromThread(() -> order.add("queued"));
            order.add("current");
            return cycle;
        }).get(5, TimeUnit.SECONDS);
        next.get(5, TimeUnit.SECONDS);
        loop.fromThread(() -> null).get(5, TimeUnit.SECONDS);

        // then
        assertThat(order).containsExactly("current", "continuation", "queued");
    }

    @Test
    @DisplayName("실행 전에 취소된 fromThread 작업은 실행되지 않는다")
    void 실행전_취소() throws Exception {
        // given
        CountDownLatch blocker = new CountDownLatch(1);
        loop.fromThread(() -> {
            blocker.await(5, TimeUnit.SECONDS);
            return null;
        });
        AtomicBoolean executed = new AtomicBoolean();
        CompletableFuture<Object> skipped = loop.fromThread(() -> {
            executed.set(true);
            return null;
        });

        // when
        skipped.cancel(false);
        blocker.countDown();
        loop.fromThread(() -> null).get(5, TimeUnit.SECONDS);

        // then
        assertThat(executed).isFalse();
        assertThat(skipped).isCancelled();
    }

    @Test
    @DisplayName("취소된 작업 안의 throwIfCancelled는 예외를 던지고 wrapCancelled가 이를 변환한다")
    void throwIfCancelled_변환() {
        // when
        CompletableFuture<String> result = loop.fromThread(() -> loop.wrapCancelled(() -> {
            loop.currentToken().cancel();
            loop.throwIfCancelled();
            return "unreachable";
        }));

        // then
        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(CancellationException.class);
    }

    // ============================================================
    // 3. 수명
    // ============================================================

    @Test
    @DisplayName("detach 이후의 작업은 실패한 future를 반환한다")
    void detach_이후() {
        // when
        EventLoops.set(EventLoops.NO_LOOP);

        // then
        assertThat(loop.isAttached()).isFalse();
        assertThat(loop.fromThread(() -> 1)).isCompletedExceptionally();
        assertThat(loop.toThread(() -> 1)).isCompletedExceptionally();
    }

    @Test
    @DisplayName("이미 attach된 loop를 다시 attach하면 실패한다")
    void 중복_attach() {
        assertThatThrownBy(() -> loop.attach())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("detach 후 다시 attach하면 새 loop 스레드로 동작한다")
    void 재_attach() throws Exception {
        // given
        EventLoops.set(EventLoops.NO_LOOP);

        // when
        EventLoops.set(loop);

        // then
        assertThat(loop.fromThread(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS))
            .isEqualTo(LOOP_THREAD);
    }

    // ============================================================
    // 4. UnifiedIterator 연동
    // ============================================================

    @Test
    @DisplayName("runAsCompleted 콜백은 순서대로 loop 스레드에서 실행된다")
    void runAsCompleted_loop() throws Exception {
        // given
        CompletableFuture<Integer> first = new CompletableFuture<>();
        CompletableFuture<Integer> second = new CompletableFuture<>();
        UnifiedIterator<Integer> iterator = new UnifiedIterator<>(List.of(first, second).iterator());
        List<String> seen = new CopyOnWriteArrayList<>();

        // when
        UnifiedFuture<Void> state = iterator.runAsCompleted(f -> {
            seen.add(Thread.currentThread().getName() + ":" + f.result());
            return true;
        });
        second.complete(2);
        first.complete(1);

        // then
        state.result(5, TimeUnit.SECONDS);
        assertThat(seen).containsExactly(LOOP_THREAD + ":1", LOOP_THREAD + ":2");
    }
}
