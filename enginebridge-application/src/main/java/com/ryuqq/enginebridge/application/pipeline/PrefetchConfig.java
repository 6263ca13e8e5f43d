package com.ryuqq.enginebridge.application.pipeline;

import com.ryuqq.enginebridge.core.spi.NativeCore;
import com.ryuqq.enginebridge.core.spi.NativeRuntime;

/**
 * PrefetchBuffer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>prefetch: 동시에 진행 중인 요청 수 상한</li>
 *   <li>backlog: 발행했지만 아직 소비되지 않은 결과 수 상한 (prefetch보다 작으면 prefetch로 올림)</li>
 * </ul>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 * @param prefetch 동시 요청 수 (1 이상)
 * @param backlog 미소비 결과 수 (1 이상)
 */
public record PrefetchConfig(
    int prefetch,
    int backlog
) {

    private static final int BACKLOG_FACTOR = 3;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: prefetch=사용 가능한 프로세서 수, backlog=prefetch×3</p>
     */
    public PrefetchConfig() {
        this(Runtime.getRuntime().availableProcessors(), Runtime.getRuntime().availableProcessors() * BACKLOG_FACTOR);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PrefetchConfig {
        if (prefetch <= 0) {
            throw new IllegalArgumentException(
                "prefetch must be positive (current: " + prefetch + ")"
            );
        }
        if (backlog <= 0) {
            throw new IllegalArgumentException(
                "backlog must be positive (current: " + backlog + ")"
            );
        }
        if (backlog < prefetch) {
            backlog = prefetch;
        }
    }

    /**
     * backlog = prefetch×3 설정.
     */
    public static PrefetchConfig of(int prefetch) {
        if (prefetch <= 0) {
            throw new IllegalArgumentException(
                "prefetch must be positive (current: " + prefetch + ")"
            );
        }
        return new PrefetchConfig(prefetch, prefetch * BACKLOG_FACTOR);
    }

    /**
     * core의 worker 수를 prefetch로 사용.
     */
    public static PrefetchConfig forCore(NativeCore core) {
        if (core == null) {
            throw new IllegalArgumentException("core cannot be null");
        }
        return of(core.workerCount());
    }

    /**
     * runtime의 worker 수를 prefetch로 사용.
     */
    public static PrefetchConfig forRuntime(NativeRuntime runtime) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        return of(runtime.availableWorkers());
    }

    /**
     * prefetch만 변경한 새 인스턴스 생성.
     */
    public PrefetchConfig withPrefetch(int prefetch) {
        return new PrefetchConfig(prefetch, backlog);
    }

    /**
     * backlog만 변경한 새 인스턴스 생성.
     */
    public PrefetchConfig withBacklog(int backlog) {
        return new PrefetchConfig(prefetch, backlog);
    }
}
