package com.ryuqq.enginebridge.application.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PrefetchBuffer 테스트.
 *
 * <p>{@link ManualRequests}로 요청 발행과 완료 시점을 테스트가 직접 제어합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
@DisplayName("PrefetchBuffer 테스트")
class PrefetchBufferTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /**
     * next()마다 완료되지 않은 future를 발행하는 요청 source.
     */
    private static final class ManualRequests implements Iterator<CompletableFuture<Integer>> {

        private final int total;
        private final int failAt;
        private final List<CompletableFuture<Integer>> issued = new ArrayList<>();

        ManualRequests(int total) {
            this(total, -1);
        }

        ManualRequests(int total, int failAt) {
            this.total = total;
            this.failAt = failAt;
        }

        @Override
        public synchronized boolean hasNext() {
            return issued.size() < total;
        }

        @Override
        public synchronized CompletableFuture<Integer> next() {
            if (issued.size() == failAt) {
                throw new IllegalStateException("source failed");
            }
            CompletableFuture<Integer> request = new CompletableFuture<>();
            issued.add(request);
            return request;
        }

        synchronized int issuedCount() {
            return issued.size();
        }

        void complete(int index) {
            CompletableFuture<Integer> request;
            synchronized (this) {
                request = issued.get(index);
            }
            request.complete(index);
        }

        void fail(int index) {
            CompletableFuture<Integer> request;
            synchronized (this) {
                request = issued.get(index);
            }
            request.completeExceptionally(new IllegalArgumentException("request " + index + " failed"));
        }
    }

    // ============================================================
    // 1. 순서 보존
    // ============================================================

    @Test
    @DisplayName("역순으로 완료되어도 발행 순서대로 반환한다")
    void 역순_완료() {
        // given
        ManualRequests requests = new ManualRequests(4);
        PrefetchBuffer<Integer> buffer = PrefetchBuffer.buffer(requests, new PrefetchConfig(4, 4));

        // when
        for (int i = 3; i >= 0; i--) {
            requests.complete(i);
        }
        List<Integer> results = new ArrayList<>();
        buffer.forEachRemaining(future -> results.add(future.join()));

        // then
        assertThat(results).containsExactly(0, 1, 2, 3);
    }

    @Test
    @DisplayName("동시 요청은 prefetch를, 미소비 요청은 backlog를 넘지 않는다")
    void 상한_준수() {
        // given
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        Iterator<CompletableFuture<Integer>> requests = new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < 50;
            }

            @Override
            public CompletableFuture<Integer> next() {
                int index = next++;
                return CompletableFuture.supplyAsync(() -> {
                    maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                    try {
                        Thread.sleep(ThreadLocalRandom.current().nextInt(1, 5));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        active.decrementAndGet();
                    }
                    return index;
                }, executor);
            }
        };

        // when
        List<Integer> results = new ArrayList<>();
        try (PrefetchBuffer<Integer> buffer = PrefetchBuffer.buffer(requests, new PrefetchConfig(3, 6))) {
            buffer.forEachRemaining(future -> results.add(future.join()));

            // then
            assertThat(buffer.peakRunning()).isLessThanOrEqualTo(3);
            assertThat(buffer.peakBuffered()).isLessThanOrEqualTo(6);
            assertThat(buffer.running()).isZero();
        }
        assertThat(results).hasSize(50).isSorted();
        assertThat(maxActive.get()).isLessThanOrEqualTo(3);
    }

    @Test
    @DisplayName("backlog가 가득 차면 소비될 때까지 새 요청을 발행하지 않는다")
    void backlog_대기() {
        // given
        ManualRequests requests = new ManualRequests(10);
        PrefetchBuffer<Integer> buffer = PrefetchBuffer.buffer(requests, new PrefetchConfig(2, 4));
        assertThat(requests.issuedCount()).isEqualTo(2);

        // when
        requests.complete(0);
        requests.complete(1);
        requests.complete(2);
        requests.complete(3);

        // then
        assertThat(requests.issuedCount()).isEqualTo(4);

        buffer.next();
        assertThat(requests.issuedCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("다음 순번이 발행될 때까지 hasNext()는 대기한다")
    void hasNext_대기() throws Exception {
        // given
        ManualRequests requests = new ManualRequests(2);
        PrefetchBuffer<Integer> buffer = PrefetchBuffer.buffer(requests, new PrefetchConfig(1, 1));
        buffer.next();

        // when
        CompletableFuture<Boolean> hasNext = CompletableFuture.supplyAsync(buffer::hasNext, executor);
        Thread.sleep(100);
        assertThat(hasNext).isNotDone();
        requests.complete(0);

        // then
        assertThat(hasNext.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(requests.issuedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("빈 source는 바로 끝난다")
    void 빈_source() {
        // given
        PrefetchBuffer<Integer> buffer = PrefetchBuffer.buffer(new ManualRequests(0), PrefetchConfig.of(2));

        // when & then
        assertThat(buffer.hasNext()).isFalse();
        assertThatThrownBy(buffer::next).isInstanceOf(NoSuchElementException.class);
    }

    // ============================================================
    // 2. 실패와 종료
    // ============================================================

    @Test
    @DisplayName("요청이 실패하면 더 이상 발행하지 않고 이미 발행된 항목은 소비할 수 있다")
    void 요청_실패() {
        // given
        ManualRequests requests = new ManualRequests(10);
        PrefetchBuffer<Integer> buffer = PrefetchBuffer.buffer(requests, new PrefetchConfig(2, 4));

        // when
        requests.fail(1);
        requests.complete(0);

        // then
        assertThat(requests.issuedCount()).isEqualTo(2);
        assertThat(buffer.next().join()).isZero();
        CompletableFuture<Integer> failed = buffer.next();
        assertThatThrownBy(failed::get)
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(buffer.hasNext()).isFalse();
    }

    @Test
    @DisplayName("source가 던진 예외는 해당 위치의 실패한 future가 된다")
    void source_예외() {
        // given
        ManualRequests requests = new ManualRequests(10, 1);
        PrefetchBuffer<Integer> buffer = PrefetchBuffer.buffer(requests, new PrefetchConfig(2, 4));

        // when
        requests.complete(0);

        // then
        assertThat(buffer.next().join()).isZero();
        assertThat(buffer.next()).isCompletedExceptionally();
        assertThat(buffer.hasNext()).isFalse();
        assertThat(requests.issuedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("close() 후에는 새 요청을 발행하지 않고 진행 중인 요청은 취소하지 않는다")
    void close() {
        // given
        ManualRequests requests = new ManualRequests(10);
        PrefetchBuffer<Integer> buffer = PrefetchBuffer.buffer(requests, new PrefetchConfig(1, 3));
        CompletableFuture<Integer> first = buffer.next();

        // when
        buffer.close();
        requests.complete(0);

        // then
        assertThat(buffer.hasNext()).isFalse();
        assertThat(requests.issuedCount()).isEqualTo(1);
        assertThat(first.join()).isZero();
        assertThat(buffer.running()).isZero();
    }

    @Test
    @DisplayName("null 인자는 허용하지 않는다")
    void null_인자() {
        assertThatThrownBy(() -> PrefetchBuffer.buffer(null, PrefetchConfig.of(1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PrefetchBuffer.buffer(new ManualRequests(1), (PrefetchConfig) null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
