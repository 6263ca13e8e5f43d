package com.ryuqq.enginebridge.core.spi;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Environment와 1:1로 대응하는 native core.
 *
 * <p><strong>hold 계약:</strong></p>
 * <ul>
 *   <li>{@link #retain()}은 외부 참조를 명시적으로 등록</li>
 *   <li>{@link #outstandingHolds()}가 0이어야만 hospice가 {@link #free()}를 호출</li>
 *   <li>{@link #free()} 이후의 요청은 실패한 future를 반환</li>
 * </ul>
 *
 * @author Engine Bridge Team
 * @since 1.0.0
 */
public interface NativeCore {

    /**
     * @return core 식별자
     */
    long id();

    /**
     * @return core의 worker thread 수
     */
    int workerCount();

    /**
     * 비동기 단건 요청.
     *
     * <p>작업은 core의 worker thread에서 실행됩니다. 제출 자체는 예외를 던지지 않으며,
     * 실패는 반환된 future의 예외로 전달됩니다.</p>
     *
     * @param work 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과 future
     */
    <T> CompletableFuture<T> request(Callable<T> work);

    /**
     * 외부 hold 등록.
     *
     * @return 닫으면 hold가 해제되는 핸들
     */
    CoreHold retain();

    /**
     * @return 열린 hold 수
     */
    int outstandingHolds();

    /**
     * Core 자원 해제. 멱등적.
     */
    void free();

    /**
     * @return free()가 호출되었으면 true
     */
    boolean isFreed();
}
