package com.ryuqq.enginebridge.adapter.loop;

import com.ryuqq.enginebridge.core.loop.CancellationToken;

/**
 * Loop 스레드에서 실행되는 작업 단위.
 *
 * <p>같은 논리적 작업의 continuation은 같은 {@link CancellationToken}을 공유합니다.
 * loop가 작업을 실행하지 못하고 멈추면 {@code onAbandon}이 호출됩니다.</p>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public final class LoopTask {

    private static final Runnable NOOP = () -> { };

    private final Runnable body;
    private final CancellationToken token;
    private final Runnable onAbandon;

    public LoopTask(Runnable body, CancellationToken token) {
        this(body, token, NOOP);
    }

    public LoopTask(Runnable body, CancellationToken token, Runnable onAbandon) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (onAbandon == null) {
            throw new IllegalArgumentException("onAbandon cannot be null");
        }
        this.body = body;
        this.token = token;
        this.onAbandon = onAbandon;
    }

    public CancellationToken token() {
        return token;
    }

    void run() {
        body.run();
    }

    void abandon() {
        onAbandon.run();
    }
}
