package com.ryuqq.enginebridge.core.loop;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * 스케줄러가 설치되지 않았을 때의 기본 loop.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>fromThread(): 호출 스레드에서 즉시 실행, 완료된 future 반환</li>
 *   <li>toThread(): 새 daemon 스레드에서 실행</li>
 *   <li>awaitFuture(): 입력 future를 그대로 반환 (후속 작업은 완료시킨 스레드에서 실행)</li>
 *   <li>nextCycle(): 이미 완료된 future</li>
 * </ul>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class NoEventLoop implements EventLoop {

    NoEventLoop() {
    }

    @Override
    public void attach() {
        // NoOp
    }

    @Override
    public void detach() {
        // NoOp
    }

    @Override
    public <T> CompletableFuture<T> fromThread(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            future.complete(task.call());
        } catch (Throwable t) {
            future.completeExceptionally(t);
        }
        return future;
    }

    @Override
    public <T> CompletableFuture<T> awaitFuture(CompletableFuture<T> future) {
        return future;
    }

    @Override
    public String toString() {
        return "NoEventLoop";
    }
}
