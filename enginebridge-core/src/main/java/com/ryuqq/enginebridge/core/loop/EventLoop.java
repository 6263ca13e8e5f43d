package com.ryuqq.enginebridge.core.loop;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * 호스트 스케줄러 어댑터 인터페이스.
 *
 * <p>한 시점에 하나의 loop만 스케줄링을 소유합니다. 설치와 교체는
 * {@link EventLoops#set(EventLoop)}를 통해서만 이루어집니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>{@link #fromThread(Callable)}는 여러 native worker thread에서 동시에 호출될 수 있음</li>
 *   <li>{@link #detach()} 이후 다른 loop가 깨끗하게 인계받을 수 있어야 함</li>
 * </ul>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public interface EventLoop {

    /**
     * Loop가 설치될 때 호출.
     */
    void attach();

    /**
     * 다른 loop가 인계받기 전에 호출.
     */
    void detach();

    /**
     * 임의의 스레드에서 작업을 loop로 옮겨 실행.
     *
     * <p>작업의 예외는 반환된 future의 실패로 전달되며, 이 메서드는 던지지 않습니다.</p>
     *
     * @param task loop에서 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과 future
     */
    <T> CompletableFuture<T> fromThread(Callable<T> task);

    /**
     * 전용 worker에서 작업 실행.
     *
     * <p>기본 구현은 매 호출마다 daemon 스레드를 하나 시작합니다.</p>
     */
    default <T> CompletableFuture<T> toThread(Callable<T> task) {
        CapturedContext context = EventLoops.captureContext();
        CompletableFuture<T> future = new CompletableFuture<>();
        Thread worker = new Thread(() -> {
            if (future.isCancelled()) {
                return;
            }
            try {
                future.complete(context.call(task));
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        }, "enginebridge-worker");
        worker.setDaemon(true);
        worker.start();
        return future;
    }

    /**
     * 다른 스레드의 future를 loop의 suspension 방식으로 연결.
     *
     * <p>반환된 future의 후속 작업은 loop 스레드에서 실행됩니다.
     * 비동기 대기를 지원하지 않는 loop는 구현하지 않아도 됩니다.</p>
     *
     * @throws UnsupportedOperationException 지원하지 않는 loop인 경우
     */
    default <T> CompletableFuture<T> awaitFuture(CompletableFuture<T> future) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support awaiting futures");
    }

    /**
     * 협력적 양보.
     *
     * <p>loop의 다음 iteration에서 완료되는 future를 반환합니다. 그 사이 현재 task가
     * 취소되었으면 {@link LoopCancelledException}으로 실패합니다.</p>
     */
    default CompletableFuture<Void> nextCycle() {
        return CompletableFuture.completedFuture(null);
    }

    /**
     * 현재 task가 취소되었으면 {@link LoopCancelledException} 발생.
     *
     * <p>취소를 지원하지 않는 loop에서는 no-op입니다.</p>
     */
    default void throwIfCancelled() {
    }

    /**
     * 블록 안에서 발생한 {@link LoopCancelledException}을 호스트의 취소 예외로 변환.
     *
     * @param body 실행할 블록
     * @return 블록의 결과
     * @throws CancellationException 블록이 취소 신호를 던진 경우
     * @throws Exception 블록이 던진 그 밖의 예외
     */
    default <T> T wrapCancelled(Callable<T> body) throws Exception {
        try {
            return body.call();
        } catch (LoopCancelledException e) {
            throw new CancellationException(e.getMessage());
        }
    }
}
