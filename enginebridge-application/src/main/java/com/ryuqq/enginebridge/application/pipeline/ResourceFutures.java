package com.ryuqq.enginebridge.application.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 닫아야 하는 결과를 담은 future 시퀀스 유틸리티.
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class ResourceFutures {

    private static final Logger log = LoggerFactory.getLogger(ResourceFutures.class);

    private ResourceFutures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 소비자가 다음 항목으로 넘어가면 직전 항목의 결과를 닫는 iterator.
     *
     * <p>각 항목은 원본과 같은 값으로 완료되는 복사본 future입니다. 직전 항목의 결과는 소비자가
     * {@code hasNext()}/{@code next()}를 다시 호출하거나 iterator를 닫을 때, 원본이 성공했다면 닫힙니다.
     * 아직 완료되지 않았다면 완료되는 즉시 닫힙니다.</p>
     *
     * @param futures 닫아야 하는 결과의 future 시퀀스
     * @return 결과를 자동으로 닫는 iterator
     */
    public static <T extends AutoCloseable> ClosingIterator<T> closeWhenNeeded(Iterator<? extends CompletionStage<T>> futures) {
        if (futures == null) {
            throw new IllegalArgumentException("futures cannot be null");
        }
        return new ClosingIterator<>(futures);
    }

    /**
     * {@link #closeWhenNeeded(Iterator)}의 반환 타입.
     */
    public static final class ClosingIterator<T extends AutoCloseable> implements Iterator<CompletableFuture<T>>, AutoCloseable {

        private final Iterator<? extends CompletionStage<T>> futures;
        private CompletionStage<T> previous;

        private ClosingIterator(Iterator<? extends CompletionStage<T>> futures) {
            this.futures = futures;
        }

        @Override
        public boolean hasNext() {
            closePrevious();
            return futures.hasNext();
        }

        @Override
        public CompletableFuture<T> next() {
            closePrevious();
            CompletionStage<T> current = futures.next();
            CompletableFuture<T> copy = new CompletableFuture<>();
            current.whenComplete((value, error) -> {
                if (error != null) {
                    copy.completeExceptionally(error);
                } else {
                    copy.complete(value);
                }
            });
            previous = current;
            return copy;
        }

        @Override
        public void close() {
            closePrevious();
        }

        private void closePrevious() {
            CompletionStage<T> done = previous;
            previous = null;
            if (done == null) {
                return;
            }
            done.whenComplete((value, error) -> {
                if (error == null && value != null) {
                    closeResource(value);
                }
            });
        }
    }

    private static void closeResource(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close resource {}", resource, e);
        }
    }
}
