package com.ryuqq.enginebridge.core.future;

import com.ryuqq.enginebridge.core.loop.EventLoops;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Loop에 독립적인 단일 값 future.
 *
 * <p>임의의 future 형태 값을 하나의 계약으로 정규화합니다. 종료 상태는
 * resolved / rejected / cancelled 중 하나이며, 한 번 결정되면 바뀌지 않습니다.</p>
 *
 * <p><strong>제공 기능:</strong></p>
 * <ul>
 *   <li>blocking 대기: {@link #result()}, {@link #result(long, TimeUnit)}</li>
 *   <li>loop를 통한 비동기 대기: {@link #awaitable()}</li>
 *   <li>조합: {@link #then}, {@link #map}, {@link #catching} (동기적으로 던지지 않음)</li>
 *   <li>콜백: {@link #addDoneCallback} (등록 순서 보장), {@link #addLoopCallback} (loop 스레드에서 실행)</li>
 *   <li>scoped 자원: {@link #withResource}, {@link #withResourceAsync}</li>
 * </ul>
 *
 * @param <T> 결과 타입
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class UnifiedFuture<T> {

    private static final Logger log = LoggerFactory.getLogger(UnifiedFuture.class);

    private final CompletableFuture<T> delegate;
    private final Object callbackLock = new Object();
    private List<Runnable> callbacks = new ArrayList<>();

    private UnifiedFuture(CompletableFuture<T> delegate) {
        this.delegate = delegate;
        delegate.whenComplete((value, error) -> fireCallbacks());
    }

    // ============================================================
    // Factories
    // ============================================================

    static <T> UnifiedFuture<T> pending() {
        return new UnifiedFuture<>(new CompletableFuture<>());
    }

    /**
     * future를 반환하는 호출을 감쌈.
     *
     * <p>호출 자체가 던진 예외는 rejected future로 변환됩니다.</p>
     *
     * @param call future를 반환하는 호출
     * @return 호출 결과를 따르는 future
     */
    public static <T> UnifiedFuture<T> fromCall(Callable<? extends CompletionStage<T>> call) {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        CompletionStage<T> stage;
        try {
            stage = call.call();
        } catch (Exception e) {
            return reject(e);
        }
        if (stage == null) {
            return reject(new IllegalStateException("call returned no future"));
        }
        return fromFuture(stage);
    }

    /**
     * 임의의 stage를 감쌈.
     *
     * @param stage 원본 stage
     * @return 원본 결과를 따르는 future
     */
    public static <T> UnifiedFuture<T> fromFuture(CompletionStage<? extends T> stage) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        UnifiedFuture<T> result = pending();
        stage.whenComplete((value, error) -> {
            if (error != null) {
                result.fail(unwrap(error));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    /**
     * @return 이미 resolved된 future
     */
    public static <T> UnifiedFuture<T> resolve(T value) {
        UnifiedFuture<T> future = pending();
        future.complete(value);
        return future;
    }

    /**
     * @return 이미 rejected된 future
     */
    public static <T> UnifiedFuture<T> reject(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        UnifiedFuture<T> future = pending();
        future.fail(error);
        return future;
    }

    boolean complete(T value) {
        return delegate.complete(value);
    }

    boolean fail(Throwable error) {
        return delegate.completeExceptionally(error);
    }

    // ============================================================
    // State
    // ============================================================

    public boolean isDone() {
        return delegate.isDone();
    }

    public boolean isCancelled() {
        return delegate.isCancelled();
    }

    /**
     * 아직 결정되지 않았으면 취소.
     *
     * @return 이 호출로 취소되었으면 true
     */
    public boolean cancel() {
        return delegate.cancel(false);
    }

    /**
     * 결과가 나올 때까지 대기.
     *
     * @return resolved 값
     * @throws CompletionException rejected인 경우 (원인 예외를 cause로 가짐)
     * @throws CancellationException 취소된 경우
     */
    public T result() {
        try {
            return delegate.get();
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for result", e);
        }
    }

    /**
     * 제한 시간 동안 결과 대기.
     *
     * @throws TimeoutException 제한 시간 안에 결정되지 않은 경우
     * @throws CompletionException rejected인 경우
     */
    public T result(long timeout, TimeUnit unit) throws TimeoutException {
        try {
            return delegate.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for result", e);
        }
    }

    /**
     * 결정될 때까지 대기한 뒤 실패 원인 반환.
     *
     * @return 실패 원인 (resolved이면 null, 취소되었으면 {@link CancellationException})
     */
    public Throwable exception() {
        Throwable error = delegate.handle((value, failure) -> failure).join();
        return error == null ? null : unwrap(error);
    }

    // ============================================================
    // Callbacks
    // ============================================================

    /**
     * 완료 콜백 등록.
     *
     * <p>콜백은 등록 순서대로 실행되며, 등록 시점의 context(현재 environment 포함)에서
     * 실행됩니다. 이미 완료된 경우 즉시 호출 스레드에서 실행됩니다.
     * 콜백 예외는 로그로 남기고 다음 콜백을 계속 실행합니다.</p>
     *
     * @param callback 이 future를 인자로 받는 콜백
     */
    public void addDoneCallback(Consumer<? super UnifiedFuture<T>> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        Runnable task = EventLoops.preserveContext(() -> callback.accept(this));
        synchronized (callbackLock) {
            if (callbacks != null) {
                callbacks.add(task);
                return;
            }
        }
        runCallback(task);
    }

    /**
     * Loop 스레드에서 실행되는 완료 콜백 등록.
     *
     * <p>원본 future를 어느 스레드가 완료시키든 콜백은 현재 loop의
     * {@link com.ryuqq.enginebridge.core.loop.EventLoop#fromThread(Callable)}를 통해 실행됩니다.</p>
     */
    public void addLoopCallback(Consumer<? super UnifiedFuture<T>> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        addDoneCallback(future -> EventLoops.get()
            .fromThread(() -> {
                callback.accept(future);
                return null;
            })
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("Loop callback failed", unwrap(error));
                }
            }));
    }

    private void fireCallbacks() {
        List<Runnable> toRun;
        synchronized (callbackLock) {
            toRun = callbacks;
            callbacks = null;
        }
        if (toRun == null) {
            return;
        }
        for (Runnable task : toRun) {
            runCallback(task);
        }
    }

    private static void runCallback(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Done callback failed", e);
        }
    }

    // ============================================================
    // Combinators
    // ============================================================

    /**
     * 성공/실패 분기 변환.
     *
     * <p>onFailure가 null이면 실패를 그대로 전달합니다. 함수가 던진 예외는
     * 파생 future를 reject합니다. 성공 값을 그대로 두고 실패만 복구하려면
     * {@link #catching(ThrowingFunction)}을 사용합니다.</p>
     *
     * @param onSuccess 성공 값 변환
     * @param onFailure 실패 원인 변환 (nullable)
     * @return 파생 future
     * @throws IllegalArgumentException onSuccess가 null인 경우
     */
    public <V> UnifiedFuture<V> then(
        ThrowingFunction<? super T, ? extends V> onSuccess,
        ThrowingFunction<? super Throwable, ? extends V> onFailure
    ) {
        if (onSuccess == null) {
            throw new IllegalArgumentException("onSuccess cannot be null");
        }
        UnifiedFuture<V> result = pending();
        addDoneCallback(source -> {
            Throwable error = source.exception();
            if (error != null) {
                if (onFailure != null) {
                    applyInto(result, onFailure, error);
                } else {
                    result.fail(error);
                }
            } else {
                applyInto(result, onSuccess, source.delegate.join());
            }
        });
        return result;
    }

    /**
     * 성공 값 변환. 실패는 그대로 전달됩니다.
     */
    public <V> UnifiedFuture<V> map(ThrowingFunction<? super T, ? extends V> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        return then(mapper, null);
    }

    /**
     * 실패 복구. 반환 값으로 resolve되며, 함수가 던지면 새 예외로 reject됩니다.
     */
    public UnifiedFuture<T> catching(ThrowingFunction<? super Throwable, ? extends T> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        return then(value -> value, handler);
    }

    private static <I, V> void applyInto(UnifiedFuture<V> target, ThrowingFunction<? super I, ? extends V> fn, I input) {
        try {
            target.complete(fn.apply(input));
        } catch (Exception e) {
            target.fail(e);
        }
    }

    // ============================================================
    // Suspension & scoped resources
    // ============================================================

    /**
     * 현재 loop의 suspension 방식으로 대기.
     *
     * @return 후속 작업이 loop 스레드에서 실행되는 future
     * @throws UnsupportedOperationException 현재 loop가 비동기 대기를 지원하지 않는 경우
     */
    public CompletableFuture<T> awaitable() {
        return EventLoops.awaitFuture(delegate.copy());
    }

    /**
     * 결과가 {@link AutoCloseable}일 때 blocking scoped 사용.
     *
     * <p>결과를 기다린 뒤 body를 실행하고, 어떤 경우에도 자원을 닫습니다.</p>
     *
     * @param body 자원을 사용하는 블록
     * @return body의 결과
     * @throws UnsupportedOperationException 결과가 AutoCloseable이 아닌 경우
     * @throws Exception body 또는 close가 던진 예외
     */
    public <R> R withResource(ThrowingFunction<? super T, R> body) throws Exception {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        T value = result();
        if (!(value instanceof AutoCloseable)) {
            throw new UnsupportedOperationException("Scoped use is not supported for " + describe(value));
        }
        try (AutoCloseable ignored = (AutoCloseable) value) {
            return body.apply(value);
        }
    }

    /**
     * 결과가 {@link AsyncCloseable} 또는 {@link AutoCloseable}일 때 비동기 scoped 사용.
     *
     * <p>{@link #awaitable()}로 결과를 기다린 뒤 body를 실행하고, body의 stage가 끝나면
     * 자원을 닫습니다. AsyncCloseable이 우선합니다.</p>
     *
     * @param body 자원을 사용하는 비동기 블록
     * @return body 결과 (close 실패는 body 실패에 suppressed로 첨부)
     */
    public <R> CompletableFuture<R> withResourceAsync(ThrowingFunction<? super T, ? extends CompletionStage<R>> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        return awaitable().thenCompose(value -> useAsync(value, body));
    }

    private static <T, R> CompletableFuture<R> useAsync(T value, ThrowingFunction<? super T, ? extends CompletionStage<R>> body) {
        if (!(value instanceof AsyncCloseable) && !(value instanceof AutoCloseable)) {
            return CompletableFuture.failedFuture(
                new UnsupportedOperationException("Scoped use is not supported for " + describe(value))
            );
        }
        CompletionStage<R> stage;
        try {
            stage = body.apply(value);
        } catch (Exception e) {
            stage = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<R> outcome = new CompletableFuture<>();
        stage.whenComplete((bodyResult, bodyError) -> closeAsync(value).whenComplete((ignored, closeError) -> {
            if (bodyError != null) {
                Throwable failure = unwrap(bodyError);
                if (closeError != null) {
                    failure.addSuppressed(unwrap(closeError));
                }
                outcome.completeExceptionally(failure);
            } else if (closeError != null) {
                outcome.completeExceptionally(unwrap(closeError));
            } else {
                outcome.complete(bodyResult);
            }
        }));
        return outcome;
    }

    private static CompletionStage<Void> closeAsync(Object resource) {
        if (resource instanceof AsyncCloseable) {
            try {
                return ((AsyncCloseable) resource).closeAsync();
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        try {
            ((AutoCloseable) resource).close();
            return CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * @return 이 future의 결과를 따르는 독립 복사본
     */
    public CompletableFuture<T> toCompletableFuture() {
        return delegate.copy();
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }

    @Override
    public String toString() {
        String state;
        if (!delegate.isDone()) {
            state = "pending";
        } else if (delegate.isCancelled()) {
            state = "cancelled";
        } else if (delegate.isCompletedExceptionally()) {
            state = "rejected";
        } else {
            state = "resolved";
        }
        return "UnifiedFuture{" + state + '}';
    }
}
