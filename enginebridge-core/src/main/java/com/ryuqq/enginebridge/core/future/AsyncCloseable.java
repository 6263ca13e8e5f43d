package com.ryuqq.enginebridge.core.future;

import java.util.concurrent.CompletionStage;

/**
 * 비동기로 닫히는 자원.
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 * @see UnifiedFuture#withResourceAsync(ThrowingFunction)
 */
@FunctionalInterface
public interface AsyncCloseable {

    /**
     * @return 자원이 닫히면 완료되는 stage
     */
    CompletionStage<Void> closeAsync();
}
