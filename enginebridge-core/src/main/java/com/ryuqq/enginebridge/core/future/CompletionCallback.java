package com.ryuqq.enginebridge.core.future;

import java.util.function.Consumer;

/**
 * {@link UnifiedIterator#runAsCompleted(CompletionCallback)}의 항목별 콜백.
 *
 * @param <T> 항목 타입
 * @author Engine Bridge Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CompletionCallback<T> {

    /**
     * 완료된 항목 처리.
     *
     * @param future 완료된 항목 (성공 또는 실패)
     * @return 계속 처리하려면 true, 여기서 멈추려면 false
     * @throws Exception 전체 실행을 실패시키는 예외
     */
    boolean onCompleted(UnifiedFuture<T> future) throws Exception;

    /**
     * 항상 계속 진행하는 콜백으로 변환.
     */
    static <T> CompletionCallback<T> consuming(Consumer<? super UnifiedFuture<T>> consumer) {
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
        return future -> {
            consumer.accept(future);
            return true;
        };
    }
}
