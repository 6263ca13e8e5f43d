package com.ryuqq.enginebridge.core.future;

import com.ryuqq.enginebridge.core.loop.CapturedContext;
import com.ryuqq.enginebridge.core.loop.EventLoops;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Future의 순서 있는 시퀀스.
 *
 * <p>하나의 future 시퀀스 위에 세 가지 소비 방식을 제공합니다:</p>
 * <ul>
 *   <li>blocking: {@link #hasNext()} / {@link #next()} (항목 실패는 next()에서 던짐)</li>
 *   <li>비동기: {@link #nextAsync()} (현재 loop의 await 사용)</li>
 *   <li>콜백: {@link #runAsCompleted(CompletionCallback)}</li>
 * </ul>
 *
 * <p>시퀀스는 한 번만 소비할 수 있으며, 소비 방식을 섞으면 커서를 공유합니다.</p>
 *
 * @param <T> 항목 타입
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class UnifiedIterator<T> implements Iterator<T>, Iterable<T> {

    private static final Logger log = LoggerFactory.getLogger(UnifiedIterator.class);

    private final Iterator<? extends CompletionStage<T>> futures;

    public UnifiedIterator(Iterator<? extends CompletionStage<T>> futures) {
        if (futures == null) {
            throw new IllegalArgumentException("futures cannot be null");
        }
        this.futures = futures;
    }

    /**
     * future 시퀀스를 반환하는 호출을 감쌈.
     *
     * <p>호출이 던진 예외는 그대로 전파됩니다.</p>
     */
    public static <T> UnifiedIterator<T> fromCall(Supplier<? extends Iterator<? extends CompletionStage<T>>> call) {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        return new UnifiedIterator<>(call.get());
    }

    /**
     * @return 원본 future 시퀀스 (커서 공유)
     */
    public Iterator<? extends CompletionStage<T>> futures() {
        return futures;
    }

    @Override
    public Iterator<T> iterator() {
        return this;
    }

    @Override
    public boolean hasNext() {
        return futures.hasNext();
    }

    /**
     * 다음 항목을 기다려 반환.
     *
     * @throws java.util.concurrent.CompletionException 항목이 실패한 경우
     */
    @Override
    public T next() {
        return UnifiedFuture.<T>fromFuture(futures.next()).result();
    }

    /**
     * 다음 항목을 현재 loop를 통해 비동기로 대기.
     *
     * @return 다음 항목 future. 시퀀스가 끝났으면 {@link NoSuchElementException}으로 실패
     */
    public CompletableFuture<T> nextAsync() {
        CompletionStage<T> next;
        try {
            if (!futures.hasNext()) {
                return CompletableFuture.failedFuture(new NoSuchElementException("No more futures"));
            }
            next = futures.next();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return EventLoops.awaitFuture(next.toCompletableFuture());
    }

    /**
     * 항목을 순서대로 기다리며 콜백 실행.
     *
     * <p>각 항목이 완료되면 콜백을 호출하고, 항목마다 loop에 제어를 한 번 돌려줍니다
     * ({@link com.ryuqq.enginebridge.core.loop.EventLoop#nextCycle()}).</p>
     *
     * <p><strong>종료 조건:</strong></p>
     * <ul>
     *   <li>시퀀스 소진 → 반환 future가 null로 resolve</li>
     *   <li>콜백이 false 반환 → null로 resolve, 더 이상 콜백 호출 없음</li>
     *   <li>콜백이 예외를 던짐 → 해당 예외로 reject</li>
     *   <li>시퀀스 자체가 예외를 던짐 → 해당 예외로 reject</li>
     *   <li>yield 중 취소 신호 → 해당 예외로 reject</li>
     * </ul>
     *
     * <p>콜백은 이 메서드를 호출한 시점의 context에서 실행됩니다.</p>
     *
     * @param callback 항목별 콜백
     * @return 전체 실행 상태
     */
    public UnifiedFuture<Void> runAsCompleted(CompletionCallback<T> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        UnifiedFuture<Void> state = UnifiedFuture.pending();
        new AsCompletedRun(callback, state, EventLoops.captureContext()).start();
        return state;
    }

    private final class AsCompletedRun {

        private final CompletionCallback<T> callback;
        private final UnifiedFuture<Void> state;
        private final CapturedContext context;

        AsCompletedRun(CompletionCallback<T> callback, UnifiedFuture<Void> state, CapturedContext context) {
            this.callback = callback;
            this.state = state;
            this.context = context;
        }

        void start() {
            schedule(() -> runCallbacks());
        }

        private void schedule(Runnable step) {
            EventLoops.get()
                .fromThread(() -> {
                    step.run();
                    return null;
                })
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        state.fail(UnifiedFuture.unwrap(error));
                    }
                });
        }

        private void runCallbacks() {
            try {
                UnifiedFuture<T> future;
                while ((future = nextFuture()) != null) {
                    if (!future.isDone()) {
                        future.addDoneCallback(this::continueOnLoop);
                        return;
                    }

                    if (!runSingleCallback(future)) {
                        return;
                    }

                    CompletableFuture<Void> nextCycle = EventLoops.get().nextCycle();
                    if (!nextCycle.isDone()) {
                        nextCycle.whenComplete((ignored, error) -> {
                            if (error != null) {
                                state.fail(UnifiedFuture.unwrap(error));
                            } else {
                                runCallbacks();
                            }
                        });
                        return;
                    }

                    // inline loop: forward a failed yield directly
                    if (nextCycle.isCompletedExceptionally()) {
                        state.fail(UnifiedFuture.unwrap(nextCycle.handle((v, e) -> e).join()));
                        return;
                    }
                }
            } catch (RuntimeException e) {
                log.error("Failed while iterating completed futures", e);
                state.fail(e);
            }
        }

        private UnifiedFuture<T> nextFuture() {
            if (state.isDone()) {
                return null;
            }
            try {
                if (!futures.hasNext()) {
                    state.complete(null);
                    return null;
                }
                return UnifiedFuture.fromFuture(futures.next());
            } catch (RuntimeException e) {
                state.fail(e);
                return null;
            }
        }

        private void continueOnLoop(UnifiedFuture<T> future) {
            schedule(() -> {
                if (runSingleCallback(future)) {
                    runCallbacks();
                }
            });
        }

        /**
         * @return 다음 항목으로 진행하면 true
         */
        private boolean runSingleCallback(UnifiedFuture<T> future) {
            if (state.isDone()) {
                return false;
            }
            boolean proceed;
            try {
                proceed = context.call(() -> callback.onCompleted(future));
            } catch (Exception e) {
                state.fail(e);
                return false;
            }
            if (!proceed) {
                state.complete(null);
                return false;
            }
            return true;
        }
    }
}
