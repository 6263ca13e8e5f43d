package com.ryuqq.enginebridge.core.loop;

/**
 * Loop에 독립적인 취소 신호.
 *
 * <p>suspension point에서 발생하며, 경계에서
 * {@link EventLoop#wrapCancelled(java.util.concurrent.Callable)}가 호스트의
 * {@link java.util.concurrent.CancellationException}으로 변환합니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public class LoopCancelledException extends RuntimeException {

    public LoopCancelledException() {
        super("Task was cancelled");
    }

    public LoopCancelledException(String message) {
        super(message);
    }
}
