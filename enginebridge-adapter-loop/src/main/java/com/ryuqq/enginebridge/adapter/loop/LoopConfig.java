package com.ryuqq.enginebridge.adapter.loop;

/**
 * Loop adapter 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threadName: loop 스레드 이름 (기본 "enginebridge-loop")</li>
 *   <li>workerThreads: toThread() 작업을 동시에 실행할 수 있는 스레드 수 (기본 4)</li>
 *   <li>shutdownTimeoutMs: detach 시 loop 스레드 종료 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 * @param threadName loop 스레드 이름 (비어 있으면 안 됨)
 * @param workerThreads worker 스레드 수 (1 이상)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 0 이상)
 */
public record LoopConfig(
    String threadName,
    int workerThreads,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: threadName="enginebridge-loop", workerThreads=4, shutdownTimeoutMs=5000</p>
     */
    public LoopConfig() {
        this("enginebridge-loop", 4, 5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LoopConfig {
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be null or blank");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException(
                "workerThreads must be positive (current: " + workerThreads + ")"
            );
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must not be negative (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * threadName만 변경한 새 인스턴스 생성.
     */
    public LoopConfig withThreadName(String threadName) {
        return new LoopConfig(threadName, workerThreads, shutdownTimeoutMs);
    }

    /**
     * workerThreads만 변경한 새 인스턴스 생성.
     */
    public LoopConfig withWorkerThreads(int workerThreads) {
        return new LoopConfig(threadName, workerThreads, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public LoopConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new LoopConfig(threadName, workerThreads, shutdownTimeoutMs);
    }
}
